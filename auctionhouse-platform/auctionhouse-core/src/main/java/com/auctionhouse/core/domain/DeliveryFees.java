package com.auctionhouse.core.domain;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Fee charged to the winning bidder on top of the bid when an auction is finalized.
 */
public record DeliveryFees(int deliverBPS, BigInteger deliverFixed) {

    public static final DeliveryFees NONE = new DeliveryFees(0, BigInteger.ZERO);

    public DeliveryFees {
        Objects.requireNonNull(deliverFixed, "Fixed delivery fee cannot be null");
    }

    public boolean isNone() {
        return deliverBPS == 0 && deliverFixed.signum() == 0;
    }

    /**
     * Fee owed on a winning bid of the given amount.
     */
    public BigInteger feeFor(BigInteger bidAmount) {
        return bidAmount.multiply(BigInteger.valueOf(deliverBPS))
                .divide(BigInteger.valueOf(10_000))
                .add(deliverFixed);
    }
}
