package com.auctionhouse.engine.settlement;

import com.auctionhouse.core.domain.Address;
import com.auctionhouse.core.domain.Listing;
import com.auctionhouse.core.domain.RevenueReceiver;
import com.auctionhouse.core.spi.RoyaltyLookupService;
import com.auctionhouse.core.spi.RoyaltyPayment;
import com.auctionhouse.engine.config.MarketplaceConfig;
import com.auctionhouse.engine.escrow.FeeLedger;
import com.auctionhouse.engine.settlement.SettlementPlan.Allocation;
import com.auctionhouse.engine.settlement.SettlementReceipt.Disposition;
import com.auctionhouse.engine.settlement.SettlementReceipt.Payout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits a sale's gross amount between the marketplace, the referrer,
 * royalty recipients and the seller or its revenue receivers, in that order.
 *
 * Planning and execution are separate: the plan (including the royalty
 * lookup) is computed before the calling operation commits any state, and
 * executed after. Integer division truncates at every step; the truncated
 * remainder flows down the chain and is kept by the seller, or by the last
 * revenue receiver.
 */
public class SettlementEngine {

    private static final Logger log = LoggerFactory.getLogger(SettlementEngine.class);
    private static final BigInteger BPS = BigInteger.valueOf(MarketplaceConfig.BPS_DENOMINATOR);

    private final PaymentDispatcher dispatcher;
    private final FeeLedger feeLedger;

    public SettlementEngine(PaymentDispatcher dispatcher, FeeLedger feeLedger) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "Payment dispatcher cannot be null");
        this.feeLedger = Objects.requireNonNull(feeLedger, "Fee ledger cannot be null");
    }

    /**
     * Computes the distribution of {@code gross} for a sale on {@code listing}.
     *
     * @param referrer referrer named by the buyer, or {@link Address#ZERO}
     */
    public SettlementPlan plan(Listing listing, BigInteger gross, Address referrer, MarketplaceConfig config) {
        Objects.requireNonNull(listing, "Listing cannot be null");
        Objects.requireNonNull(gross, "Gross amount cannot be null");
        if (gross.signum() < 0) {
            throw new IllegalArgumentException("Gross amount cannot be negative");
        }

        List<Allocation> allocations = new ArrayList<>();
        BigInteger remaining = gross;

        // 1. Marketplace fee, at the rate captured when the listing was created
        BigInteger marketplaceFee = bps(gross, listing.getMarketplaceBPS());
        if (marketplaceFee.signum() > 0) {
            allocations.add(new Allocation(PayoutKind.MARKETPLACE_FEE, config.custodian(), marketplaceFee));
            remaining = remaining.subtract(marketplaceFee);
        }

        // 2. Referrer fee
        if (Address.isPresent(referrer) && listing.getReferrerBPS() > 0) {
            BigInteger referrerFee = bps(gross, listing.getReferrerBPS());
            if (referrerFee.signum() > 0) {
                allocations.add(new Allocation(PayoutKind.REFERRER_FEE, referrer, referrerFee));
                remaining = remaining.subtract(referrerFee);
            }
        }

        // 3. Royalties
        if (owesRoyalty(listing)) {
            for (RoyaltyPayment royalty : lookupRoyalties(listing, gross, remaining, config.royaltyLookup())) {
                allocations.add(new Allocation(PayoutKind.ROYALTY, royalty.recipient(), royalty.amount()));
                remaining = remaining.subtract(royalty.amount());
            }
        }

        // 4. Seller, or revenue receivers pro-rata
        List<RevenueReceiver> receivers = listing.getReceivers();
        if (receivers.isEmpty()) {
            if (remaining.signum() > 0) {
                allocations.add(new Allocation(PayoutKind.SELLER_PROCEEDS, listing.getSeller(), remaining));
            }
        } else {
            BigInteger base = remaining;
            for (int i = 0; i < receivers.size(); i++) {
                RevenueReceiver receiver = receivers.get(i);
                BigInteger share = i == receivers.size() - 1
                        ? remaining
                        : bps(base, receiver.receiverBPS());
                if (share.signum() > 0) {
                    allocations.add(new Allocation(PayoutKind.RECEIVER_SHARE, receiver.receiver(), share));
                }
                remaining = remaining.subtract(share);
            }
        }

        return new SettlementPlan(listing.getId(), gross, listing.getCurrency(), allocations);
    }

    /**
     * Executes a plan. Never throws for a failed payout; the amount is escrowed instead.
     */
    public SettlementReceipt execute(SettlementPlan plan) {
        List<Payout> payouts = new ArrayList<>(plan.allocations().size());
        for (Allocation allocation : plan.allocations()) {
            if (allocation.kind() == PayoutKind.MARKETPLACE_FEE) {
                feeLedger.credit(plan.currency(), allocation.amount());
                payouts.add(new Payout(allocation.kind(), allocation.recipient(), allocation.amount(),
                        Disposition.FEE_LEDGER));
            } else {
                payouts.add(dispatcher.disburse(allocation.kind(), allocation.recipient(), allocation.amount(),
                        plan.currency()));
            }
        }
        log.info("Settled {} of {} for listing {} across {} payouts",
                plan.gross(), plan.currency(), plan.listingId(), payouts.size());
        return new SettlementReceipt(plan.listingId(), plan.gross(), plan.currency(), payouts);
    }

    /**
     * Lazily created tokens and tokens sold by their creator carry no royalty obligation.
     */
    private boolean owesRoyalty(Listing listing) {
        return !listing.getToken().lazy() && !listing.isTokenCreator();
    }

    private List<RoyaltyPayment> lookupRoyalties(Listing listing, BigInteger gross, BigInteger available,
                                                 RoyaltyLookupService royaltyLookup) {
        if (royaltyLookup == null || gross.signum() == 0) {
            return List.of();
        }
        List<RoyaltyPayment> royalties;
        try {
            royalties = royaltyLookup.getRoyalty(listing.getToken(), gross);
        } catch (RuntimeException e) {
            log.warn("Royalty lookup failed for listing {}; settling without royalties", listing.getId(), e);
            return List.of();
        }
        if (royalties == null || royalties.isEmpty()) {
            return List.of();
        }

        List<RoyaltyPayment> payable = new ArrayList<>();
        BigInteger total = BigInteger.ZERO;
        for (RoyaltyPayment royalty : royalties) {
            if (royalty.amount().signum() < 0) {
                log.warn("Royalty lookup returned a negative amount for listing {}; ignoring royalties",
                        listing.getId());
                return List.of();
            }
            if (royalty.amount().signum() > 0) {
                payable.add(royalty);
                total = total.add(royalty.amount());
            }
        }
        if (total.compareTo(available) > 0) {
            log.warn("Royalties {} exceed remaining proceeds {} for listing {}; ignoring royalties",
                    total, available, listing.getId());
            return List.of();
        }
        return payable;
    }

    static BigInteger bps(BigInteger amount, int basisPoints) {
        return amount.multiply(BigInteger.valueOf(basisPoints)).divide(BPS);
    }
}
