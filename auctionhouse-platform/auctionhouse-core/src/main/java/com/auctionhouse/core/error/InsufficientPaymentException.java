package com.auctionhouse.core.error;

import java.math.BigInteger;

/**
 * Tendered amount is below the amount required by the operation.
 */
public class InsufficientPaymentException extends MarketplaceException {

    private final BigInteger required;
    private final BigInteger offered;

    public InsufficientPaymentException(BigInteger required, BigInteger offered) {
        super("INSUFFICIENT_PAYMENT", "Amount " + offered + " is below required " + required);
        this.required = required;
        this.offered = offered;
    }

    public BigInteger getRequired() {
        return required;
    }

    public BigInteger getOffered() {
        return offered;
    }
}
