package com.auctionhouse.core.spi;

import com.auctionhouse.core.domain.Address;
import com.auctionhouse.core.domain.TokenReference;

import java.math.BigInteger;
import java.util.List;

/**
 * Resolves royalty obligations for an asset.
 */
public interface RoyaltyLookupService {

    /**
     * Royalties owed when the token sells for {@code saleValue}.
     */
    List<RoyaltyPayment> getRoyalty(TokenReference token, BigInteger saleValue);

    /**
     * Whether {@code account} is the token's original creator. Creators selling
     * their own work owe no royalty.
     */
    default boolean isCreator(TokenReference token, Address account) {
        return false;
    }
}
