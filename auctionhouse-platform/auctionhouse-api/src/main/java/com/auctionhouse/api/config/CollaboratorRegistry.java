package com.auctionhouse.api.config;

import com.auctionhouse.core.domain.Address;
import com.auctionhouse.core.spi.BuyerIdentityVerifier;
import com.auctionhouse.core.spi.CollaboratorDirectory;
import com.auctionhouse.core.spi.DynamicPriceOracle;
import com.auctionhouse.core.spi.LazyAssetDeliverer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-listing collaborators registered by the embedding application.
 * Unregistered references resolve to empty, which fails the operation that
 * needed them.
 */
public class CollaboratorRegistry implements CollaboratorDirectory {

    private static final Logger log = LoggerFactory.getLogger(CollaboratorRegistry.class);

    private final Map<Address, BuyerIdentityVerifier> verifiers = new ConcurrentHashMap<>();
    private final Map<Address, DynamicPriceOracle> oracles = new ConcurrentHashMap<>();
    private final Map<Address, LazyAssetDeliverer> deliverers = new ConcurrentHashMap<>();

    public void registerIdentityVerifier(Address reference, BuyerIdentityVerifier verifier) {
        verifiers.put(Objects.requireNonNull(reference, "Verifier reference cannot be null"),
                Objects.requireNonNull(verifier, "Verifier cannot be null"));
        log.info("Registered identity verifier {}", reference);
    }

    public void registerPriceOracle(Address tokenContract, DynamicPriceOracle oracle) {
        oracles.put(Objects.requireNonNull(tokenContract, "Token contract cannot be null"),
                Objects.requireNonNull(oracle, "Oracle cannot be null"));
        log.info("Registered price oracle for {}", tokenContract);
    }

    public void registerLazyDeliverer(Address tokenContract, LazyAssetDeliverer deliverer) {
        deliverers.put(Objects.requireNonNull(tokenContract, "Token contract cannot be null"),
                Objects.requireNonNull(deliverer, "Deliverer cannot be null"));
        log.info("Registered lazy deliverer for {}", tokenContract);
    }

    @Override
    public Optional<BuyerIdentityVerifier> identityVerifier(Address reference) {
        return Optional.ofNullable(verifiers.get(reference));
    }

    @Override
    public Optional<DynamicPriceOracle> priceOracle(Address tokenContract) {
        return Optional.ofNullable(oracles.get(tokenContract));
    }

    @Override
    public Optional<LazyAssetDeliverer> lazyDeliverer(Address tokenContract) {
        return Optional.ofNullable(deliverers.get(tokenContract));
    }
}
