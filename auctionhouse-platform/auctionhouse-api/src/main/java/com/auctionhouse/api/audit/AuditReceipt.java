package com.auctionhouse.api.audit;

import com.auctionhouse.engine.event.MarketplaceEventType;

import java.math.BigInteger;

/**
 * Immutable audit record of one marketplace event, chained to its predecessor
 * by {@code previousReceiptHash}.
 *
 * @param actor      account that triggered the event, null for system events
 * @param merkleRoot root of the batch this receipt was anchored in, null until anchored
 */
public record AuditReceipt(
        long sequence,
        MarketplaceEventType eventType,
        long listingId,
        String actor,
        BigInteger amount,
        long timestamp,
        String detailsHash,
        String previousReceiptHash,
        String receiptHash,
        String merkleRoot,
        MerkleTree.MerkleProof merkleProof
) {
    public boolean isAnchored() {
        return merkleRoot != null;
    }

    AuditReceipt anchored(String root, MerkleTree.MerkleProof proof) {
        return new AuditReceipt(sequence, eventType, listingId, actor, amount, timestamp, detailsHash,
                previousReceiptHash, receiptHash, root, proof);
    }
}
