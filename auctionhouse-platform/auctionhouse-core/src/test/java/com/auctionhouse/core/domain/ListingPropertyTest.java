package com.auctionhouse.core.domain;

import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for the Listing aggregate.
 */
class ListingPropertyTest {

    private static final Address SELLER = Address.of("0x000000000000000000000000000000000000000a");
    private static final Address BUYER = Address.of("0x000000000000000000000000000000000000000b");
    private static final TokenReference TOKEN =
            TokenReference.multiUnit(Address.of("0x000000000000000000000000000000000000000c"), 1);

    private static Listing listing(long available, long start, long end) {
        ListingDetails details = new ListingDetails(BigInteger.TEN, ListingType.FIXED_PRICE, available, 1, 0, 0,
                Address.ZERO, Address.ZERO, start, end);
        return Listing.create(1, SELLER, 0, 0, details, TOKEN, List.of(), DeliveryFees.NONE, false, false, 0);
    }

    // ==================== Supply ====================

    @Property(tries = 200)
    @Label("Units sold never exceed units available")
    void soldNeverExceedsAvailable(
            @ForAll @LongRange(min = 1, max = 100) long available,
            @ForAll @Size(max = 30) List<@LongRange(min = 1, max = 20) Long> sales) {

        Listing listing = listing(available, 100, 200);

        for (long units : sales) {
            if (units <= listing.remainingUnits()) {
                listing.recordSale(units);
            } else {
                long before = listing.getTotalSold();
                assertThatThrownBy(() -> listing.recordSale(units)).isInstanceOf(IllegalStateException.class);
                assertThat(listing.getTotalSold()).isEqualTo(before);
            }
            assertThat(listing.getTotalSold()).isBetween(0L, available);
        }
    }

    @Property(tries = 100)
    @Label("A copy is unaffected by later changes to the original")
    void copyIsIndependent(@ForAll @LongRange(min = 2, max = 100) long available) {
        Listing original = listing(available, 100, 200);
        original.putOffer(Offer.make(BUYER, BigInteger.ONE, 150, Address.ZERO));
        Listing snapshot = original.copy();

        original.recordSale(1);
        original.removeOffer(BUYER);
        original.replaceBid(Bid.place(BUYER, BigInteger.TEN, 160, Address.ZERO));
        original.markFinalized();

        assertThat(snapshot.getTotalSold()).isZero();
        assertThat(snapshot.getOffer(BUYER)).isPresent();
        assertThat(snapshot.getBid()).isEmpty();
        assertThat(snapshot.isFinalized()).isFalse();
    }

    // ==================== Phase ====================

    @Property(tries = 200)
    @Label("Phase follows the schedule until finalized")
    void phaseFollowsSchedule(@ForAll @LongRange(min = 0, max = 400) long now) {
        Listing listing = listing(1, 100, 200);

        ListingPhase expected = now < 100 ? ListingPhase.OPEN
                : now < 200 ? ListingPhase.ACTIVE
                : ListingPhase.ENDED;
        assertThat(listing.phase(now)).isEqualTo(expected);
        assertThat(listing.hasEnded(now)).isEqualTo(now >= 200);

        listing.markFinalized();
        assertThat(listing.phase(now)).isEqualTo(ListingPhase.FINALIZED);
    }

    @Example
    void deferredStartPinsWindowOnFirstAction() {
        Listing listing = listing(1, 0, 3_600);
        assertThat(listing.phase(1_000_000)).isEqualTo(ListingPhase.OPEN);
        assertThat(listing.hasEnded(1_000_000)).isFalse();

        listing.start(5_000);

        assertThat(listing.getDetails().startTime()).isEqualTo(5_000);
        assertThat(listing.getDetails().endTime()).isEqualTo(8_600);
        assertThat(listing.phase(5_000)).isEqualTo(ListingPhase.ACTIVE);
    }

    @Example
    void finalizedListingRejectsMutation() {
        Listing listing = listing(2, 100, 200);
        listing.markFinalized();

        assertThatThrownBy(() -> listing.recordSale(1)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> listing.extendTo(300)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(listing::markFinalized).isInstanceOf(IllegalStateException.class);
    }

    @Example
    void activityIsBidSaleOrAcceptedOffer() {
        Listing listing = listing(3, 100, 200);
        listing.putOffer(Offer.make(BUYER, BigInteger.ONE, 150, Address.ZERO));
        assertThat(listing.hasActivity()).isFalse();

        listing.putOffer(listing.getOffer(BUYER).orElseThrow().markAccepted());
        assertThat(listing.hasActivity()).isTrue();
    }

    @Example
    void deliveryFeeAddsFixedPartToPercentage() {
        DeliveryFees fees = new DeliveryFees(250, BigInteger.valueOf(7));

        assertThat(fees.feeFor(BigInteger.valueOf(1_000))).isEqualTo(BigInteger.valueOf(32));
        assertThat(DeliveryFees.NONE.isNone()).isTrue();
        assertThat(fees.isNone()).isFalse();
    }
}
