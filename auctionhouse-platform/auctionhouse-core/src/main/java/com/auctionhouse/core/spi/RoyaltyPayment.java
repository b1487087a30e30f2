package com.auctionhouse.core.spi;

import com.auctionhouse.core.domain.Address;

import java.math.BigInteger;
import java.util.Objects;

/**
 * One royalty recipient and the amount owed to it on a sale.
 */
public record RoyaltyPayment(Address recipient, BigInteger amount) {

    public RoyaltyPayment {
        Objects.requireNonNull(recipient, "Royalty recipient cannot be null");
        Objects.requireNonNull(amount, "Royalty amount cannot be null");
    }
}
