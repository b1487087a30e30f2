package com.auctionhouse.core.spi;

import com.auctionhouse.core.domain.Address;

import java.util.Optional;

/**
 * Resolves per-listing collaborators from the references stored on a listing.
 * Identity verifiers are looked up by their own address; price oracles and
 * lazy deliverers by the token contract that implements them.
 */
public interface CollaboratorDirectory {

    Optional<BuyerIdentityVerifier> identityVerifier(Address reference);

    Optional<DynamicPriceOracle> priceOracle(Address tokenContract);

    Optional<LazyAssetDeliverer> lazyDeliverer(Address tokenContract);
}
