package com.auctionhouse.engine.listing;

import com.auctionhouse.core.domain.Address;
import com.auctionhouse.core.domain.DeliveryFees;
import com.auctionhouse.core.domain.TokenReference;
import com.auctionhouse.core.error.AuthorizationException;
import com.auctionhouse.core.error.InsufficientPaymentException;
import com.auctionhouse.engine.support.MarketplaceFixture;
import com.auctionhouse.engine.validation.ListingRequest;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import java.math.BigInteger;

import static com.auctionhouse.engine.support.MarketplaceFixture.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for auction bidding and finalization.
 */
class AuctionBidPropertyTest {

    private static final Address FIRST = account(80);
    private static final Address SECOND = account(81);

    private static long newAuction(MarketplaceFixture fx, BigInteger reserve, int minIncrementBPS, DeliveryFees fees) {
        TokenReference token = uniqueToken(1);
        fx.assets.mint(SELLER, token, 1);
        ListingRequest request = ListingRequest.of(auction(reserve, minIncrementBPS, 0, T0, T0 + 1000), token)
                .withDeliveryFees(fees);
        return fx.machine.create(SELLER, request).getId();
    }

    @Property(tries = 100)
    @Label("A challenger must beat the current bid by the minimum increment; the outbid bidder gets exactly their bid back")
    void challengerBeatsMinimumIncrementAndOutbidIsRefunded(
            @ForAll @IntRange(min = 0, max = 10_000) int minIncrementBPS,
            @ForAll @LongRange(min = 1, max = 1_000_000_000_000L) long first,
            @ForAll @LongRange(min = 0, max = 1_000_000_000_000L) long raise) {

        MarketplaceFixture fx = new MarketplaceFixture();
        long id = newAuction(fx, BigInteger.ONE, minIncrementBPS, DeliveryFees.NONE);
        BigInteger firstBid = BigInteger.valueOf(first);
        BigInteger secondBid = firstBid.add(BigInteger.valueOf(raise));
        BigInteger increment = firstBid.multiply(BigInteger.valueOf(minIncrementBPS)).divide(BigInteger.valueOf(10_000));
        BigInteger minimum = firstBid.add(increment.max(BigInteger.ONE));

        fx.machine.bid(FIRST, id, firstBid, Address.ZERO, null);

        if (secondBid.compareTo(minimum) >= 0) {
            fx.machine.bid(SECOND, id, secondBid, Address.ZERO, null);
            assertThat(fx.payments.paidTo(FIRST)).isEqualTo(firstBid);
            assertThat(fx.machine.getBid(id)).hasValueSatisfying(bid -> assertThat(bid.bidder()).isEqualTo(SECOND));
        } else {
            assertThatThrownBy(() -> fx.machine.bid(SECOND, id, secondBid, Address.ZERO, null))
                    .isInstanceOf(InsufficientPaymentException.class);
            assertThat(fx.payments.paidTo(FIRST)).isZero();
            assertThat(fx.payments.collectedFrom(SECOND)).isZero();
        }
        assertThat(fx.machine.getCurrentPrice(id)).isGreaterThan(fx.machine.getBid(id).orElseThrow().amount());
    }

    @Property(tries = 50)
    @Label("First bid must meet the reserve")
    void firstBidMeetsReserve(
            @ForAll @LongRange(min = 1, max = 1_000_000_000L) long reserve,
            @ForAll @LongRange(min = 1, max = 2_000_000_000L) long amount) {

        MarketplaceFixture fx = new MarketplaceFixture();
        long id = newAuction(fx, BigInteger.valueOf(reserve), 0, DeliveryFees.NONE);

        if (amount >= reserve) {
            fx.machine.bid(FIRST, id, BigInteger.valueOf(amount), Address.ZERO, null);
            assertThat(fx.machine.getBid(id)).isPresent();
        } else {
            assertThatThrownBy(() -> fx.machine.bid(FIRST, id, BigInteger.valueOf(amount), Address.ZERO, null))
                    .isInstanceOfSatisfying(InsufficientPaymentException.class,
                            e -> assertThat(e.getRequired()).isEqualTo(BigInteger.valueOf(reserve)));
        }
    }

    @Property(tries = 50)
    @Label("A top bidder raising their own bid pays only the difference")
    void selfRaisePaysDifference(
            @ForAll @LongRange(min = 1, max = 1_000_000L) long first,
            @ForAll @LongRange(min = 1, max = 1_000_000L) long raise) {

        MarketplaceFixture fx = new MarketplaceFixture();
        long id = newAuction(fx, BigInteger.ONE, 0, DeliveryFees.NONE);

        fx.machine.bid(FIRST, id, BigInteger.valueOf(first), Address.ZERO, null);
        fx.machine.bid(FIRST, id, BigInteger.valueOf(first + raise), Address.ZERO, null);

        assertThat(fx.payments.collectedFrom(FIRST)).isEqualTo(BigInteger.valueOf(first + raise));
        assertThat(fx.payments.paidTo(FIRST)).isZero();
    }

    @Property(tries = 50)
    @Label("Winning bidder pays the delivery fee on finalize; the marketplace keeps it")
    void deliveryFeeChargedToWinner(
            @ForAll @IntRange(min = 0, max = 10_000) int deliverBPS,
            @ForAll @LongRange(min = 0, max = 1_000_000L) long deliverFixed,
            @ForAll @LongRange(min = 1, max = 1_000_000_000L) long bid) {

        Assume.that(deliverBPS > 0 || deliverFixed > 0);
        MarketplaceFixture fx = new MarketplaceFixture();
        DeliveryFees fees = new DeliveryFees(deliverBPS, BigInteger.valueOf(deliverFixed));
        long id = newAuction(fx, BigInteger.ONE, 0, fees);
        BigInteger amount = BigInteger.valueOf(bid);
        BigInteger fee = fees.feeFor(amount);

        fx.machine.bid(FIRST, id, amount, Address.ZERO, null);
        assertThat(fx.machine.getTotalPrice(id)).isEqualTo(fx.machine.getCurrentPrice(id).add(fee));
        fx.clock.set(T0 + 1000);

        assertThatThrownBy(() -> fx.machine.finalize(SELLER, id))
                .isInstanceOf(AuthorizationException.class)
                .hasFieldOrPropertyWithValue("reason", "BIDDER_MUST_FINALIZE");
        fx.machine.finalize(FIRST, id);

        assertThat(fx.payments.collectedFrom(FIRST)).isEqualTo(amount.add(fee));
        assertThat(fx.fees.balanceOf(Address.ZERO)).isEqualTo(fee);
        assertThat(fx.payments.paidTo(SELLER)).isEqualTo(amount);
        assertThat(fx.assets.unitsOf(FIRST, uniqueToken(1))).isEqualTo(1);
    }

    @Example
    void sellerCannotBid() {
        MarketplaceFixture fx = new MarketplaceFixture();
        long id = newAuction(fx, BigInteger.ONE, 0, DeliveryFees.NONE);

        assertThatThrownBy(() -> fx.machine.bid(SELLER, id, BigInteger.TEN, Address.ZERO, null))
                .isInstanceOf(AuthorizationException.class)
                .hasFieldOrPropertyWithValue("reason", "SELLER_CANNOT_BID");
    }

    @Example
    void unsoldAuctionReturnsLotToSeller() {
        MarketplaceFixture fx = new MarketplaceFixture();
        long id = newAuction(fx, BigInteger.ONE, 0, DeliveryFees.NONE);
        fx.clock.set(T0 + 1000);

        fx.machine.finalize(account(99), id);

        assertThat(fx.assets.unitsOf(SELLER, uniqueToken(1))).isEqualTo(1);
        assertThat(fx.machine.getListing(id).isFinalized()).isTrue();
    }
}
