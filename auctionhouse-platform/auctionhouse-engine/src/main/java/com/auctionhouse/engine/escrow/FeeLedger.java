package com.auctionhouse.engine.escrow;

import com.auctionhouse.core.domain.Address;
import com.auctionhouse.core.error.StateException;
import com.auctionhouse.core.error.TransferFailureException;
import com.auctionhouse.core.spi.PaymentTransferProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Marketplace revenue accumulated per currency: marketplace fees, delivery
 * fees and cancellation holdbacks. Withdrawal authorization is enforced by
 * the caller.
 */
public class FeeLedger {

    private static final Logger log = LoggerFactory.getLogger(FeeLedger.class);

    private final Map<Address, BigInteger> collected = new ConcurrentHashMap<>();
    private final PaymentTransferProvider payments;

    public FeeLedger(PaymentTransferProvider payments) {
        this.payments = Objects.requireNonNull(payments, "Payment provider cannot be null");
    }

    public void credit(Address currency, BigInteger amount) {
        if (amount.signum() <= 0) {
            return;
        }
        collected.merge(currency, amount, BigInteger::add);
    }

    public BigInteger balanceOf(Address currency) {
        return collected.getOrDefault(currency, BigInteger.ZERO);
    }

    /**
     * Pays accumulated revenue to {@code receiver}. Must run inside a guarded operation.
     */
    public void withdraw(Address currency, BigInteger amount, Address receiver) {
        BigInteger balance = balanceOf(currency);
        if (amount.compareTo(balance) > 0) {
            throw new StateException("INSUFFICIENT_FEE_BALANCE",
                    "Collected fees " + balance + " are below requested " + amount);
        }
        collected.computeIfPresent(currency, (k, current) -> {
            BigInteger left = current.subtract(amount);
            return left.signum() == 0 ? null : left;
        });

        boolean paid;
        try {
            paid = payments.pay(receiver, amount, currency);
        } catch (RuntimeException e) {
            log.warn("Fee withdrawal payout to {} threw", receiver, e);
            paid = false;
        }
        if (!paid) {
            collected.merge(currency, amount, BigInteger::add);
            throw new TransferFailureException("FEE_WITHDRAWAL_FAILED",
                    "Fee withdrawal of " + amount + " to " + receiver + " failed");
        }
        log.info("Withdrew {} of {} collected fees to {}", amount, currency, receiver);
    }
}
