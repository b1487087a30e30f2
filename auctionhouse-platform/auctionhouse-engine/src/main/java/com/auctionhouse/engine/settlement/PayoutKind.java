package com.auctionhouse.engine.settlement;

/**
 * Why money leaves (or is retained by) the marketplace.
 */
public enum PayoutKind {
    MARKETPLACE_FEE,
    REFERRER_FEE,
    ROYALTY,
    RECEIVER_SHARE,
    SELLER_PROCEEDS,
    REFUND,
    DELIVERY_FEE,
    HOLDBACK
}
