package com.auctionhouse.core.error;

/**
 * Base class for every error that aborts a marketplace operation.
 * {@link #getReason()} names the violated rule in a machine-readable form so a
 * caller can correct the request and retry.
 */
public abstract class MarketplaceException extends RuntimeException {

    private final String reason;

    protected MarketplaceException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    protected MarketplaceException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
