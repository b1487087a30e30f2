package com.auctionhouse.engine.event;

import com.auctionhouse.core.domain.Address;

import java.math.BigInteger;
import java.util.Map;

/**
 * Event emitted after a marketplace operation commits.
 *
 * @param listingId 0 for events not tied to a listing
 * @param amount    money moved by the operation, zero when none
 */
public record MarketplaceEvent(
        MarketplaceEventType eventType,
        long listingId,
        Address actor,
        BigInteger amount,
        long timestamp,
        Map<String, Object> metadata
) {
    public MarketplaceEvent {
        amount = amount != null ? amount : BigInteger.ZERO;
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public MarketplaceEvent(MarketplaceEventType eventType, long listingId, Address actor,
                            BigInteger amount, long timestamp) {
        this(eventType, listingId, actor, amount, timestamp, Map.of());
    }
}
