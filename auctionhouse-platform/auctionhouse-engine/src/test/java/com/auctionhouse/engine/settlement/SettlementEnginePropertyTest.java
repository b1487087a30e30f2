package com.auctionhouse.engine.settlement;

import com.auctionhouse.core.domain.Address;
import com.auctionhouse.core.domain.DeliveryFees;
import com.auctionhouse.core.domain.Listing;
import com.auctionhouse.core.domain.ListingDetails;
import com.auctionhouse.core.domain.ListingType;
import com.auctionhouse.core.domain.RevenueReceiver;
import com.auctionhouse.core.domain.TokenKind;
import com.auctionhouse.core.domain.TokenReference;
import com.auctionhouse.core.spi.RoyaltyLookupService;
import com.auctionhouse.core.spi.RoyaltyPayment;
import com.auctionhouse.engine.config.MarketplaceConfig;
import com.auctionhouse.engine.escrow.EscrowLedger;
import com.auctionhouse.engine.escrow.FeeLedger;
import com.auctionhouse.engine.event.EventBus;
import com.auctionhouse.engine.settlement.SettlementPlan.Allocation;
import com.auctionhouse.engine.settlement.SettlementReceipt.Disposition;
import com.auctionhouse.engine.support.MutableClock;
import com.auctionhouse.engine.support.OperationGuard;
import com.auctionhouse.engine.support.RecordingPaymentProvider;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for SettlementEngine.
 *
 * Invariants covered:
 * - Allocations always sum to the gross amount
 * - Truncation remainders go to the seller or the last revenue receiver
 * - Royalties are skipped when the lookup misbehaves
 */
class SettlementEnginePropertyTest {

    private static final Address CUSTODIAN = address(1);
    private static final Address SELLER = address(10);
    private static final Address REFERRER = address(20);
    private static final Address ARTIST = address(30);
    private static final Address CONTRACT = address(100);

    private static Address address(int n) {
        return Address.of(String.format("0x%040x", n));
    }

    private static Listing listing(int marketplaceBPS, int referrerBPS, List<RevenueReceiver> receivers,
                                   TokenReference token, boolean tokenCreator) {
        ListingDetails details = new ListingDetails(BigInteger.ONE, ListingType.FIXED_PRICE, 1, 1, 0, 0,
                Address.ZERO, Address.ZERO, 1, 2);
        return Listing.create(1, SELLER, marketplaceBPS, referrerBPS, details, token, receivers,
                DeliveryFees.NONE, false, tokenCreator, 0);
    }

    private static Listing listing(int marketplaceBPS, int referrerBPS, List<RevenueReceiver> receivers) {
        return listing(marketplaceBPS, referrerBPS, receivers, TokenReference.unique(CONTRACT, 1), false);
    }

    private static MarketplaceConfig config(RoyaltyLookupService royalties) {
        return new MarketplaceConfig(1, true, 0, 0, CUSTODIAN, Set.of(), null, royalties, null);
    }

    private static RoyaltyLookupService fixedRoyalty(BigInteger amount) {
        return (token, saleValue) -> List.of(new RoyaltyPayment(ARTIST, amount));
    }

    private static final class Harness {
        final RecordingPaymentProvider payments = new RecordingPaymentProvider();
        final EscrowLedger escrow = new EscrowLedger(payments, new OperationGuard(), new EventBus(),
                new MutableClock(0));
        final FeeLedger fees = new FeeLedger(payments);
        final SettlementEngine engine = new SettlementEngine(new PaymentDispatcher(payments, escrow), fees);
    }

    // ==================== Conservation ====================

    @Property(tries = 200)
    @Label("Allocations always sum to the gross amount")
    void allocationsSumToGross(
            @ForAll @BigRange(min = "0", max = "1000000000000000000000") BigInteger gross,
            @ForAll @IntRange(min = 0, max = 1_500) int marketplaceBPS,
            @ForAll @IntRange(min = 0, max = 1_500) int referrerBPS,
            @ForAll boolean withReferrer,
            @ForAll @IntRange(min = 0, max = 5_000) int royaltyBPS) {

        BigInteger royalty = gross.multiply(BigInteger.valueOf(royaltyBPS)).divide(BigInteger.valueOf(10_000));
        Listing listing = listing(marketplaceBPS, referrerBPS, List.of());

        SettlementPlan plan = new Harness().engine.plan(listing, gross,
                withReferrer ? REFERRER : Address.ZERO, config(fixedRoyalty(royalty)));

        assertThat(plan.total()).isEqualTo(gross);
        assertThat(plan.allocations()).allSatisfy(a -> assertThat(a.amount().signum()).isPositive());
        assertThat(plan.amountFor(PayoutKind.MARKETPLACE_FEE))
                .isEqualTo(SettlementEngine.bps(gross, marketplaceBPS));
        if (!withReferrer) {
            assertThat(plan.amountFor(PayoutKind.REFERRER_FEE)).isZero();
        }
    }

    @Property(tries = 200)
    @Label("Revenue receivers split the remainder and the last receiver keeps the truncation dust")
    void receiversShareRemainder(
            @ForAll @BigRange(min = "1", max = "1000000000000") BigInteger gross,
            @ForAll @IntRange(min = 0, max = 1_500) int marketplaceBPS,
            @ForAll @IntRange(min = 1, max = 9_999) int firstShare) {

        Address first = address(40);
        Address last = address(41);
        List<RevenueReceiver> receivers = List.of(
                new RevenueReceiver(first, firstShare),
                new RevenueReceiver(last, 10_000 - firstShare));
        Listing listing = listing(marketplaceBPS, 0, receivers);

        SettlementPlan plan = new Harness().engine.plan(listing, gross, Address.ZERO, config(null));

        BigInteger base = gross.subtract(SettlementEngine.bps(gross, marketplaceBPS));
        BigInteger firstAmount = SettlementEngine.bps(base, firstShare);
        assertThat(shareOf(plan, first)).isEqualTo(firstAmount);
        assertThat(shareOf(plan, last)).isEqualTo(base.subtract(firstAmount));
        assertThat(plan.amountFor(PayoutKind.SELLER_PROCEEDS)).isZero();
        assertThat(plan.total()).isEqualTo(gross);
    }

    private static BigInteger shareOf(SettlementPlan plan, Address recipient) {
        return plan.allocations().stream()
                .filter(a -> a.recipient().equals(recipient))
                .map(Allocation::amount)
                .reduce(BigInteger.ZERO, BigInteger::add);
    }

    @Property(tries = 100)
    @Label("Executing a plan pays or escrows every allocation exactly once")
    void executionPaysEveryAllocation(
            @ForAll @BigRange(min = "1", max = "1000000000000") BigInteger gross,
            @ForAll @IntRange(min = 0, max = 1_500) int marketplaceBPS,
            @ForAll boolean sellerRejects) {

        Harness harness = new Harness();
        if (sellerRejects) {
            harness.payments.rejectPaymentsTo(SELLER);
        }
        SettlementPlan plan = harness.engine.plan(listing(marketplaceBPS, 0, List.of()), gross, Address.ZERO,
                config(null));

        SettlementReceipt receipt = harness.engine.execute(plan);

        BigInteger fee = SettlementEngine.bps(gross, marketplaceBPS);
        BigInteger proceeds = gross.subtract(fee);
        assertThat(harness.fees.balanceOf(Address.ZERO)).isEqualTo(fee);
        if (sellerRejects) {
            assertThat(harness.payments.paidTo(SELLER)).isZero();
            assertThat(harness.escrow.balanceOf(SELLER, Address.ZERO)).isEqualTo(proceeds);
            assertThat(receipt.anyEscrowed()).isEqualTo(proceeds.signum() > 0);
        } else {
            assertThat(harness.payments.paidTo(SELLER)).isEqualTo(proceeds);
            assertThat(receipt.anyEscrowed()).isFalse();
        }
        assertThat(receipt.payouts()).filteredOn(p -> p.kind() == PayoutKind.MARKETPLACE_FEE)
                .allSatisfy(p -> assertThat(p.disposition()).isEqualTo(Disposition.FEE_LEDGER));
    }

    // ==================== Royalties ====================

    @Example
    void royaltiesArePaidBeforeSeller() {
        Listing listing = listing(1_000, 0, List.of());

        SettlementPlan plan = new Harness().engine.plan(listing, BigInteger.valueOf(1_000), Address.ZERO,
                config(fixedRoyalty(BigInteger.valueOf(50))));

        assertThat(plan.allocations()).extracting(Allocation::kind)
                .containsExactly(PayoutKind.MARKETPLACE_FEE, PayoutKind.ROYALTY, PayoutKind.SELLER_PROCEEDS);
        assertThat(plan.amountFor(PayoutKind.ROYALTY)).isEqualTo(BigInteger.valueOf(50));
        assertThat(plan.amountFor(PayoutKind.SELLER_PROCEEDS)).isEqualTo(BigInteger.valueOf(850));
    }

    @Example
    void royaltyLookupFailureSettlesWithoutRoyalties() {
        RoyaltyLookupService broken = (token, saleValue) -> {
            throw new IllegalStateException("registry unreachable");
        };

        SettlementPlan plan = new Harness().engine.plan(listing(0, 0, List.of()), BigInteger.valueOf(1_000),
                Address.ZERO, config(broken));

        assertThat(plan.amountFor(PayoutKind.ROYALTY)).isZero();
        assertThat(plan.amountFor(PayoutKind.SELLER_PROCEEDS)).isEqualTo(BigInteger.valueOf(1_000));
    }

    @Example
    void negativeRoyaltyIsIgnored() {
        RoyaltyLookupService lookup = (token, saleValue) -> List.of(
                new RoyaltyPayment(ARTIST, BigInteger.TEN),
                new RoyaltyPayment(address(31), BigInteger.valueOf(-1)));

        SettlementPlan plan = new Harness().engine.plan(listing(0, 0, List.of()), BigInteger.valueOf(1_000),
                Address.ZERO, config(lookup));

        assertThat(plan.amountFor(PayoutKind.ROYALTY)).isZero();
    }

    @Property(tries = 50)
    @Label("Royalties exceeding what is left after fees are ignored")
    void excessiveRoyaltiesAreIgnored(
            @ForAll @IntRange(min = 0, max = 1_500) int marketplaceBPS,
            @ForAll @LongRange(min = 1, max = 1_000) long excess) {

        BigInteger gross = BigInteger.valueOf(10_000);
        BigInteger remaining = gross.subtract(SettlementEngine.bps(gross, marketplaceBPS));
        List<RoyaltyPayment> royalties = new ArrayList<>();
        royalties.add(new RoyaltyPayment(ARTIST, remaining));
        royalties.add(new RoyaltyPayment(address(31), BigInteger.valueOf(excess)));

        SettlementPlan plan = new Harness().engine.plan(listing(marketplaceBPS, 0, List.of()), gross,
                Address.ZERO, config((token, saleValue) -> royalties));

        assertThat(plan.amountFor(PayoutKind.ROYALTY)).isZero();
        assertThat(plan.amountFor(PayoutKind.SELLER_PROCEEDS)).isEqualTo(remaining);
    }

    @Example
    void creatorAndLazySalesOweNoRoyalty() {
        RoyaltyLookupService lookup = fixedRoyalty(BigInteger.valueOf(100));
        Harness harness = new Harness();

        SettlementPlan byCreator = harness.engine.plan(
                listing(0, 0, List.of(), TokenReference.unique(CONTRACT, 1), true),
                BigInteger.valueOf(1_000), Address.ZERO, config(lookup));
        SettlementPlan lazy = harness.engine.plan(
                listing(0, 0, List.of(), TokenReference.lazy(CONTRACT, 2, TokenKind.MULTI_UNIT), false),
                BigInteger.valueOf(1_000), Address.ZERO, config(lookup));

        assertThat(byCreator.amountFor(PayoutKind.ROYALTY)).isZero();
        assertThat(lazy.amountFor(PayoutKind.ROYALTY)).isZero();
    }

    @Example
    void referrerIsPaidOnlyWhenNamedAndEnabled() {
        Harness harness = new Harness();

        SettlementPlan enabled = harness.engine.plan(listing(0, 500, List.of()), BigInteger.valueOf(1_000),
                REFERRER, config(null));
        SettlementPlan disabled = harness.engine.plan(listing(0, 0, List.of()), BigInteger.valueOf(1_000),
                REFERRER, config(null));

        assertThat(enabled.amountFor(PayoutKind.REFERRER_FEE)).isEqualTo(BigInteger.valueOf(50));
        assertThat(disabled.amountFor(PayoutKind.REFERRER_FEE)).isZero();
    }
}
