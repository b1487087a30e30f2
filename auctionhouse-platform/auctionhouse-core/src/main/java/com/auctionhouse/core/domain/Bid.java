package com.auctionhouse.core.domain;

import java.math.BigInteger;
import java.util.Objects;

/**
 * The live highest bid on an auction listing. Replaced, never appended, by a higher bid.
 */
public record Bid(
        BigInteger amount,
        Address bidder,
        boolean delivered,
        boolean settled,
        boolean refunded,
        long timestamp,
        Address referrer
) {
    public Bid {
        Objects.requireNonNull(amount, "Bid amount cannot be null");
        Objects.requireNonNull(bidder, "Bidder cannot be null");
        referrer = referrer != null ? referrer : Address.ZERO;
    }

    public static Bid place(Address bidder, BigInteger amount, long timestamp, Address referrer) {
        return new Bid(amount, bidder, false, false, false, timestamp, referrer);
    }

    public Bid markSettled() {
        return new Bid(amount, bidder, delivered, true, refunded, timestamp, referrer);
    }

    public Bid markDelivered() {
        return new Bid(amount, bidder, true, settled, refunded, timestamp, referrer);
    }

    public Bid markRefunded() {
        return new Bid(amount, bidder, delivered, settled, true, timestamp, referrer);
    }
}
