package com.auctionhouse.api.audit;

import com.auctionhouse.engine.event.EventBus;
import com.auctionhouse.engine.event.MarketplaceEvent;
import com.auctionhouse.engine.event.MarketplaceEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Audit Receipt Ledger Service.
 * Records every marketplace event as an append-only, hash-chained receipt and
 * batches unanchored receipts under a Merkle root.
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    static final String GENESIS = "GENESIS";

    // Batch size for Merkle tree anchoring
    static final int MERKLE_BATCH_SIZE = 100;

    private final List<AuditReceipt> receipts = new ArrayList<>();
    private final Map<String, Integer> indexByHash = new HashMap<>();
    private int firstUnanchored = 0;

    public AuditService(EventBus eventBus) {
        eventBus.subscribe(MarketplaceEventType.ALL, this::appendReceipt);
    }

    /**
     * Appends a receipt for {@code event}, chained to the most recent receipt.
     */
    public synchronized AuditReceipt appendReceipt(MarketplaceEvent event) {
        Objects.requireNonNull(event, "Event cannot be null");
        String previousHash = receipts.isEmpty() ? GENESIS : receipts.get(receipts.size() - 1).receiptHash();
        String actor = event.actor() != null ? event.actor().value() : null;
        String detailsHash = MerkleTree.sha256(canonicalDetails(event.metadata()));

        AuditReceipt unsealed = new AuditReceipt(receipts.size(), event.eventType(), event.listingId(), actor,
                event.amount(), event.timestamp(), detailsHash, previousHash, null, null, null);
        AuditReceipt receipt = new AuditReceipt(unsealed.sequence(), unsealed.eventType(), unsealed.listingId(),
                actor, unsealed.amount(), unsealed.timestamp(), detailsHash, previousHash,
                computeReceiptHash(unsealed), null, null);

        receipts.add(receipt);
        indexByHash.put(receipt.receiptHash(), receipts.size() - 1);
        log.debug("Audit receipt {} for {} on listing {}", receipt.sequence(), receipt.eventType(),
                receipt.listingId());
        return receipt;
    }

    /**
     * Anchors up to {@value #MERKLE_BATCH_SIZE} unanchored receipts under one Merkle root.
     */
    public synchronized MerkleAnchorResult anchorBatch() {
        int end = Math.min(receipts.size(), firstUnanchored + MERKLE_BATCH_SIZE);
        if (end == firstUnanchored) {
            return new MerkleAnchorResult(null, 0, Collections.emptyList());
        }
        List<AuditReceipt> batch = receipts.subList(firstUnanchored, end);
        MerkleTree tree = MerkleTree.build(batch.stream().map(AuditReceipt::receiptHash).toList());

        List<Long> anchored = new ArrayList<>();
        for (int i = 0; i < batch.size(); i++) {
            AuditReceipt receipt = batch.get(i);
            batch.set(i, receipt.anchored(tree.getRoot(), tree.getProof(i)));
            anchored.add(receipt.sequence());
        }
        firstUnanchored = end;
        log.info("Anchored {} audit receipts under Merkle root {}", anchored.size(), tree.getRoot());
        return new MerkleAnchorResult(tree.getRoot(), anchored.size(), List.copyOf(anchored));
    }

    public synchronized ReceiptVerificationResult verifyReceiptIntegrity(long sequence) {
        AuditReceipt receipt = getReceipt(sequence);
        boolean hashValid = computeReceiptHash(receipt).equals(receipt.receiptHash());

        boolean chainValid;
        if (sequence == 0) {
            chainValid = GENESIS.equals(receipt.previousReceiptHash());
        } else {
            Integer previous = indexByHash.get(receipt.previousReceiptHash());
            chainValid = previous != null && previous == sequence - 1
                    && receipts.get(previous).timestamp() <= receipt.timestamp();
        }
        return new ReceiptVerificationResult(sequence, hashValid, chainValid, hashValid && chainValid,
                receipt.merkleProof() != null);
    }

    public synchronized MerkleVerificationResult verifyMerkleProof(long sequence, String expectedRoot) {
        AuditReceipt receipt = getReceipt(sequence);
        if (receipt.merkleProof() == null) {
            return new MerkleVerificationResult(sequence, false, "Receipt has no Merkle proof");
        }
        boolean valid = receipt.merkleProof().leafHash().equals(receipt.receiptHash())
                && MerkleTree.verifyProof(receipt.merkleProof(), expectedRoot);
        return new MerkleVerificationResult(sequence, valid,
                valid ? "Proof verified successfully" : "Proof verification failed");
    }

    public synchronized AuditReceipt getReceipt(long sequence) {
        if (sequence < 0 || sequence >= receipts.size()) {
            throw new ReceiptNotFoundException("Receipt not found: " + sequence);
        }
        return receipts.get((int) sequence);
    }

    public synchronized Optional<AuditReceipt> latestReceipt() {
        return receipts.isEmpty() ? Optional.empty() : Optional.of(receipts.get(receipts.size() - 1));
    }

    public synchronized List<AuditReceipt> getReceiptsByListing(long listingId) {
        return receipts.stream().filter(r -> r.listingId() == listingId).toList();
    }

    public synchronized List<AuditReceipt> getReceiptsByActor(String actor) {
        return receipts.stream().filter(r -> actor != null && actor.equalsIgnoreCase(r.actor())).toList();
    }

    public synchronized List<AuditReceipt> getReceiptsByEventType(MarketplaceEventType eventType) {
        return receipts.stream().filter(r -> r.eventType() == eventType).toList();
    }

    public synchronized int size() {
        return receipts.size();
    }

    private static String computeReceiptHash(AuditReceipt receipt) {
        return MerkleTree.sha256(String.join("|",
                Long.toString(receipt.sequence()),
                receipt.eventType().name(),
                Long.toString(receipt.listingId()),
                String.valueOf(receipt.actor()),
                receipt.amount().toString(),
                Long.toString(receipt.timestamp()),
                receipt.detailsHash(),
                receipt.previousReceiptHash()));
    }

    /**
     * Metadata in key order, so equal maps always hash alike.
     */
    static String canonicalDetails(Map<String, Object> metadata) {
        return new TreeMap<>(metadata).entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("|"));
    }

    // Result records
    public record MerkleAnchorResult(String merkleRoot, int receiptCount, List<Long> anchoredSequences) {}

    public record ReceiptVerificationResult(
            long sequence,
            boolean hashValid,
            boolean chainValid,
            boolean overallValid,
            boolean hasMerkleProof
    ) {}

    public record MerkleVerificationResult(long sequence, boolean valid, String message) {}

    public static class ReceiptNotFoundException extends RuntimeException {
        public ReceiptNotFoundException(String message) { super(message); }
    }
}
