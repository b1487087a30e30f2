package com.auctionhouse.core.domain;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Seller-supplied sale terms.
 *
 * @param initialAmount     reserve (auction) or unit price (fixed price); zero for oracle and offer sales
 * @param type              sale format
 * @param totalAvailable    units put up for sale
 * @param totalPerSale      units delivered per sale
 * @param extensionInterval anti-sniping window in seconds (auctions)
 * @param minIncrementBPS   minimum raise over the current bid (auctions)
 * @param currency          payment currency, {@link Address#ZERO} for native
 * @param identityVerifier  buyer identity verifier reference, {@link Address#ZERO} for none
 * @param startTime         epoch seconds, or 0 to start on the first buyer action
 * @param endTime           epoch seconds, or a duration in seconds while startTime is 0
 */
public record ListingDetails(
        BigInteger initialAmount,
        ListingType type,
        long totalAvailable,
        long totalPerSale,
        long extensionInterval,
        int minIncrementBPS,
        Address currency,
        Address identityVerifier,
        long startTime,
        long endTime
) {
    public ListingDetails {
        Objects.requireNonNull(initialAmount, "Initial amount cannot be null");
        Objects.requireNonNull(type, "Listing type cannot be null");
        currency = currency != null ? currency : Address.ZERO;
        identityVerifier = identityVerifier != null ? identityVerifier : Address.ZERO;
    }

    public boolean startsOnFirstAction() {
        return startTime == 0;
    }

    /**
     * Pins a deferred schedule to an absolute window beginning at {@code now}.
     */
    public ListingDetails startingAt(long now) {
        if (!startsOnFirstAction()) {
            return this;
        }
        return new ListingDetails(initialAmount, type, totalAvailable, totalPerSale, extensionInterval,
                minIncrementBPS, currency, identityVerifier, now, now + endTime);
    }

    public ListingDetails withEndTime(long newEndTime) {
        return new ListingDetails(initialAmount, type, totalAvailable, totalPerSale, extensionInterval,
                minIncrementBPS, currency, identityVerifier, startTime, newEndTime);
    }

    public ListingDetails withTerms(BigInteger newInitialAmount, long newStartTime, long newEndTime) {
        return new ListingDetails(newInitialAmount, type, totalAvailable, totalPerSale, extensionInterval,
                minIncrementBPS, currency, identityVerifier, newStartTime, newEndTime);
    }

    public boolean hasIdentityVerifier() {
        return !identityVerifier.isZero();
    }
}
