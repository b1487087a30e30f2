package com.auctionhouse.core.domain;

/**
 * Sale formats supported by the marketplace.
 */
public enum ListingType {
    /** Single lot sold to the highest bidder after the end time. */
    INDIVIDUAL_AUCTION,
    /** Fixed unit price, many buyers until supply is exhausted. */
    FIXED_PRICE,
    /** Price quoted per purchase by the token's price oracle; lazily delivered. */
    DYNAMIC_PRICE,
    /** No asking price; the seller accepts offers. */
    OFFERS_ONLY;

    public boolean isAuction() {
        return this == INDIVIDUAL_AUCTION;
    }

    public boolean isPurchasable() {
        return this == FIXED_PRICE || this == DYNAMIC_PRICE;
    }
}
