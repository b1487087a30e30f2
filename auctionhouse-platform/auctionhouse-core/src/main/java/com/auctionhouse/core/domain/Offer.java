package com.auctionhouse.core.domain;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Funds an offerer has committed to a listing. One live offer per offerer.
 */
public record Offer(
        Address offerer,
        BigInteger amount,
        long timestamp,
        boolean accepted,
        Address referrer
) {
    public Offer {
        Objects.requireNonNull(offerer, "Offerer cannot be null");
        Objects.requireNonNull(amount, "Offer amount cannot be null");
        referrer = referrer != null ? referrer : Address.ZERO;
    }

    public static Offer make(Address offerer, BigInteger amount, long timestamp, Address referrer) {
        return new Offer(offerer, amount, timestamp, false, referrer);
    }

    public Offer increasedBy(BigInteger increment, long now) {
        return new Offer(offerer, amount.add(increment), now, accepted, referrer);
    }

    public Offer markAccepted() {
        return new Offer(offerer, amount, timestamp, true, referrer);
    }
}
