package com.auctionhouse.api.audit;

import com.auctionhouse.api.audit.AuditService.MerkleAnchorResult;
import com.auctionhouse.core.domain.Address;
import com.auctionhouse.engine.event.EventBus;
import com.auctionhouse.engine.event.MarketplaceEvent;
import com.auctionhouse.engine.event.MarketplaceEventType;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for the audit receipt ledger.
 */
class AuditServicePropertyTest {

    private static final Address BIDDER = Address.of("0x00000000000000000000000000000000000000b1");
    private static final MarketplaceEventType[] TYPES = {
            MarketplaceEventType.LISTING_CREATED, MarketplaceEventType.BID_PLACED,
            MarketplaceEventType.PURCHASE, MarketplaceEventType.LISTING_FINALIZED
    };

    private static MarketplaceEvent event(int i) {
        return new MarketplaceEvent(TYPES[i % TYPES.length], 1 + i % 3, BIDDER,
                BigInteger.valueOf(i * 100L), 1_700_000_000L + i, Map.of("index", i));
    }

    // ==================== Hash chain ====================

    @Property(tries = 30)
    @Label("Events emitted on the bus become a verifiable hash chain")
    void emittedEventsFormVerifiableChain(@ForAll @IntRange(min = 1, max = 60) int count) {
        EventBus bus = new EventBus();
        AuditService audit = new AuditService(bus);

        for (int i = 0; i < count; i++) {
            bus.emit(event(i));
        }

        assertThat(audit.size()).isEqualTo(count);
        assertThat(audit.getReceipt(0).previousReceiptHash()).isEqualTo(AuditService.GENESIS);
        for (int i = 0; i < count; i++) {
            AuditReceipt receipt = audit.getReceipt(i);
            if (i > 0) {
                assertThat(receipt.previousReceiptHash()).isEqualTo(audit.getReceipt(i - 1).receiptHash());
            }
            assertThat(audit.verifyReceiptIntegrity(i).overallValid()).isTrue();
            assertThat(audit.verifyReceiptIntegrity(i).hasMerkleProof()).isFalse();
        }
        assertThat(audit.latestReceipt()).contains(audit.getReceipt(count - 1));
    }

    @Example
    void queriesFilterByListingActorAndType() {
        AuditService audit = new AuditService(new EventBus());
        for (int i = 0; i < 12; i++) {
            audit.appendReceipt(event(i));
        }
        audit.appendReceipt(new MarketplaceEvent(MarketplaceEventType.CONFIG_CHANGED, 0, null, null, 1L));

        assertThat(audit.getReceiptsByListing(1)).hasSize(4);
        assertThat(audit.getReceiptsByActor("0x00000000000000000000000000000000000000c1")).isEmpty();
        assertThat(audit.getReceiptsByActor(BIDDER.value())).hasSize(12);
        assertThat(audit.getReceiptsByEventType(MarketplaceEventType.BID_PLACED)).hasSize(3);
        assertThat(audit.getReceiptsByEventType(MarketplaceEventType.CONFIG_CHANGED).get(0).actor()).isNull();
    }

    @Example
    void detailsHashIgnoresMetadataInsertionOrder() {
        Map<String, Object> forward = new LinkedHashMap<>();
        forward.put("currency", "0xaa");
        forward.put("receiver", "0xbb");
        Map<String, Object> backward = new LinkedHashMap<>();
        backward.put("receiver", "0xbb");
        backward.put("currency", "0xaa");

        assertThat(AuditService.canonicalDetails(forward)).isEqualTo(AuditService.canonicalDetails(backward));
        assertThat(AuditService.canonicalDetails(forward)).isEqualTo("currency=0xaa|receiver=0xbb");
    }

    @Example
    void unknownReceiptIsRejected() {
        AuditService audit = new AuditService(new EventBus());

        assertThatThrownBy(() -> audit.getReceipt(0)).isInstanceOf(AuditService.ReceiptNotFoundException.class);
        assertThatThrownBy(() -> audit.verifyReceiptIntegrity(-1))
                .isInstanceOf(AuditService.ReceiptNotFoundException.class);
    }

    // ==================== Merkle anchoring ====================

    @Property(tries = 20)
    @Label("Anchoring covers receipts in batches and every anchored proof verifies")
    void anchoredReceiptsVerifyAgainstBatchRoot(@ForAll @IntRange(min = 1, max = 250) int count) {
        AuditService audit = new AuditService(new EventBus());
        for (int i = 0; i < count; i++) {
            audit.appendReceipt(event(i));
        }

        int anchored = 0;
        MerkleAnchorResult batch;
        while ((batch = audit.anchorBatch()).receiptCount() > 0) {
            assertThat(batch.receiptCount()).isLessThanOrEqualTo(AuditService.MERKLE_BATCH_SIZE);
            for (long sequence : batch.anchoredSequences()) {
                assertThat(audit.getReceipt(sequence).merkleRoot()).isEqualTo(batch.merkleRoot());
                assertThat(audit.verifyMerkleProof(sequence, batch.merkleRoot()).valid()).isTrue();
                assertThat(audit.verifyReceiptIntegrity(sequence).overallValid()).isTrue();
            }
            anchored += batch.receiptCount();
        }

        assertThat(anchored).isEqualTo(count);
        assertThat(batch.merkleRoot()).isNull();
    }

    @Example
    void proofFailsAgainstWrongRootAndUnanchoredHasNone() {
        AuditService audit = new AuditService(new EventBus());
        audit.appendReceipt(event(0));
        audit.appendReceipt(event(1));
        MerkleAnchorResult batch = audit.anchorBatch();
        audit.appendReceipt(event(2));

        assertThat(audit.verifyMerkleProof(0, batch.merkleRoot()).valid()).isTrue();
        assertThat(audit.verifyMerkleProof(0, MerkleTree.sha256("other")).valid()).isFalse();
        assertThat(audit.verifyMerkleProof(2, batch.merkleRoot()).valid()).isFalse();
        assertThat(audit.getReceipt(2).isAnchored()).isFalse();
    }
}
