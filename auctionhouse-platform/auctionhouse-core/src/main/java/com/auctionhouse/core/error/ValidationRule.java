package com.auctionhouse.core.error;

/**
 * Listing configuration rules enforced at creation and modification time.
 */
public enum ValidationRule {
    INVALID_SELLER,
    INVALID_AMOUNT,
    INVALID_QUANTITY,
    INVALID_SCHEDULE,
    INVALID_BPS,
    INVALID_RECEIVERS,
    LAZY_TOKEN_NOT_ALLOWED,
    LAZY_TOKEN_REQUIRED,
    UNIQUE_TOKEN_QUANTITY,
    AUCTION_SINGLE_LOT,
    AUCTION_TERMS_NOT_ALLOWED,
    DELIVERY_FEE_NOT_ALLOWED,
    INITIAL_AMOUNT_MUST_BE_ZERO,
    PER_SALE_MUST_BE_ONE,
    START_MUST_BE_FUTURE,
    OFFERS_NOT_ALLOWED,
    INVALID_REQUEST
}
