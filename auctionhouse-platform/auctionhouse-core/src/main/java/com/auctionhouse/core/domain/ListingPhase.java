package com.auctionhouse.core.domain;

/**
 * Phase of a listing, derived lazily from its schedule and finalized flag.
 */
public enum ListingPhase {
    OPEN,
    ACTIVE,
    ENDED,
    FINALIZED
}
