package com.auctionhouse.engine.settlement;

import com.auctionhouse.core.domain.Address;

import java.math.BigInteger;
import java.util.List;

/**
 * Ordered distribution of one sale's gross amount, computed before any
 * listing state is committed. Allocations always sum to {@code gross}.
 */
public record SettlementPlan(
        long listingId,
        BigInteger gross,
        Address currency,
        List<Allocation> allocations
) {
    public SettlementPlan {
        allocations = List.copyOf(allocations);
    }

    public BigInteger total() {
        return allocations.stream().map(Allocation::amount).reduce(BigInteger.ZERO, BigInteger::add);
    }

    public BigInteger amountFor(PayoutKind kind) {
        return allocations.stream()
                .filter(a -> a.kind() == kind)
                .map(Allocation::amount)
                .reduce(BigInteger.ZERO, BigInteger::add);
    }

    public record Allocation(PayoutKind kind, Address recipient, BigInteger amount) {}
}
