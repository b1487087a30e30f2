package com.auctionhouse.engine.config;

/**
 * When offers may be rescinded.
 *
 * @param offersOnlyRescindGraceSeconds      offerers on offers-only listings may rescind this long after the end time
 * @param auctionOffersRescindableAfterBid  offers attached to an auction stay rescindable once a bid exists
 * @param sellerRescindRequiresEnd           the seller may force-rescind others' offers only after the listing ended
 */
public record OfferPolicy(
        long offersOnlyRescindGraceSeconds,
        boolean auctionOffersRescindableAfterBid,
        boolean sellerRescindRequiresEnd
) {
    public static final long DEFAULT_GRACE_SECONDS = 24L * 60 * 60;

    public static final OfferPolicy DEFAULT = new OfferPolicy(DEFAULT_GRACE_SECONDS, true, true);

    public OfferPolicy {
        if (offersOnlyRescindGraceSeconds < 0) {
            throw new IllegalArgumentException("Grace period cannot be negative");
        }
    }
}
