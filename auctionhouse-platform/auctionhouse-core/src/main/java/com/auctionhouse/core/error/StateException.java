package com.auctionhouse.core.error;

/**
 * Operation is not valid for the listing's current phase.
 */
public class StateException extends MarketplaceException {

    public StateException(String reason, String message) {
        super(reason, message);
    }
}
