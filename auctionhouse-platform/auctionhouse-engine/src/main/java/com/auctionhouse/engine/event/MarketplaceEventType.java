package com.auctionhouse.engine.event;

/**
 * Observable marketplace events for external auditing and indexing.
 */
public enum MarketplaceEventType {
    // Listing lifecycle
    LISTING_CREATED,
    LISTING_MODIFIED,
    LISTING_FINALIZED,
    LISTING_CANCELLED,

    // Buyer actions
    PURCHASE,
    BID_PLACED,
    OFFER_MADE,
    OFFER_ACCEPTED,
    OFFER_RESCINDED,

    // Money movement
    PROCEEDS_COLLECTED,
    ESCROW_WITHDRAWAL,
    FEES_WITHDRAWN,

    // Administration
    CONFIG_CHANGED,

    // Wildcard for subscribing to all events
    ALL
}
