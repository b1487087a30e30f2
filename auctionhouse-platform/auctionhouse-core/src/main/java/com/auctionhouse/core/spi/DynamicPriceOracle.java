package com.auctionhouse.core.spi;

import java.math.BigInteger;

/**
 * Quotes the price of dynamically-priced sales.
 */
public interface DynamicPriceOracle {

    /**
     * Total price for {@code count} sales given {@code alreadyDelivered} units sold so far.
     */
    BigInteger quote(BigInteger tokenId, long alreadyDelivered, long count);
}
