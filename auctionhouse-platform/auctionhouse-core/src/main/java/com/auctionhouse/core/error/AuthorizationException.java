package com.auctionhouse.core.error;

/**
 * Seller, buyer or administrator is not permitted to perform the operation.
 */
public class AuthorizationException extends MarketplaceException {

    public AuthorizationException(String reason, String message) {
        super(reason, message);
    }
}
