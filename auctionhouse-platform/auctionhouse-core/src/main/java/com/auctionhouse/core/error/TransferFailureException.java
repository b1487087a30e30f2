package com.auctionhouse.core.error;

/**
 * An asset or payment movement collaborator reported failure.
 */
public class TransferFailureException extends MarketplaceException {

    public TransferFailureException(String reason, String message) {
        super(reason, message);
    }

    public TransferFailureException(String reason, String message, Throwable cause) {
        super(reason, message, cause);
    }
}
