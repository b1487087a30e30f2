package com.auctionhouse.engine.settlement;

import com.auctionhouse.core.domain.Address;

import java.math.BigInteger;
import java.util.List;

/**
 * What actually happened to each allocation of a settlement.
 */
public record SettlementReceipt(
        long listingId,
        BigInteger gross,
        Address currency,
        List<Payout> payouts
) {
    public SettlementReceipt {
        payouts = List.copyOf(payouts);
    }

    public BigInteger paidTo(Address recipient) {
        return payouts.stream()
                .filter(p -> p.recipient().equals(recipient))
                .map(Payout::amount)
                .reduce(BigInteger.ZERO, BigInteger::add);
    }

    public boolean anyEscrowed() {
        return payouts.stream().anyMatch(p -> p.disposition() == Disposition.ESCROWED);
    }

    public record Payout(PayoutKind kind, Address recipient, BigInteger amount, Disposition disposition) {}

    public enum Disposition {
        /** Delivered directly by the payment provider. */
        PAID,
        /** Direct delivery failed; credited to the recipient's escrow balance. */
        ESCROWED,
        /** Retained as marketplace revenue. */
        FEE_LEDGER
    }
}
