package com.auctionhouse.core.domain;

import java.util.Objects;

/**
 * Share of the seller's proceeds, in basis points of the post-fee remainder.
 */
public record RevenueReceiver(Address receiver, int receiverBPS) {

    public RevenueReceiver {
        Objects.requireNonNull(receiver, "Receiver cannot be null");
    }
}
