package com.auctionhouse.core.spi;

import com.auctionhouse.core.domain.Address;

import java.math.BigInteger;

/**
 * Creates lazily-listed assets directly in the buyer's hands at sale time.
 */
public interface LazyAssetDeliverer {

    /**
     * @param index units delivered before this sale
     * @return false if nothing was delivered
     */
    boolean deliver(long listingId, Address to, BigInteger tokenId, long count,
                    BigInteger amount, Address currency, long index);
}
