package com.auctionhouse.engine.escrow;

import com.auctionhouse.core.domain.Address;
import com.auctionhouse.core.error.StateException;
import com.auctionhouse.core.error.TransferFailureException;
import com.auctionhouse.core.error.ValidationException;
import com.auctionhouse.core.error.ValidationRule;
import com.auctionhouse.core.spi.PaymentTransferProvider;
import com.auctionhouse.engine.event.EventBus;
import com.auctionhouse.engine.event.MarketplaceEvent;
import com.auctionhouse.engine.event.MarketplaceEventType;
import com.auctionhouse.engine.support.OperationGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Balances held for beneficiaries whose direct payout could not be delivered.
 * Only the beneficiary may drain its own entry.
 */
public class EscrowLedger {

    private static final Logger log = LoggerFactory.getLogger(EscrowLedger.class);

    private final Map<BalanceKey, BigInteger> balances = new ConcurrentHashMap<>();
    private final PaymentTransferProvider payments;
    private final OperationGuard guard;
    private final EventBus eventBus;
    private final Clock clock;

    public EscrowLedger(PaymentTransferProvider payments, OperationGuard guard, EventBus eventBus, Clock clock) {
        this.payments = Objects.requireNonNull(payments, "Payment provider cannot be null");
        this.guard = Objects.requireNonNull(guard, "Operation guard cannot be null");
        this.eventBus = Objects.requireNonNull(eventBus, "Event bus cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    public void credit(Address beneficiary, Address currency, BigInteger amount) {
        if (amount.signum() <= 0) {
            return;
        }
        balances.merge(new BalanceKey(beneficiary, currency), amount, BigInteger::add);
        log.info("Escrowed {} of {} for {}", amount, currency, beneficiary);
    }

    public BigInteger balanceOf(Address beneficiary, Address currency) {
        return balances.getOrDefault(new BalanceKey(beneficiary, currency), BigInteger.ZERO);
    }

    /**
     * Pays out {@code amount} of the caller's own escrow balance.
     * The balance is debited before the payout and restored if it fails.
     *
     * @throws StateException if the balance is too small
     * @throws TransferFailureException if the payout was not delivered
     */
    public BigInteger withdraw(Address caller, Address currency, BigInteger amount) {
        Objects.requireNonNull(caller, "Caller cannot be null");
        Objects.requireNonNull(currency, "Currency cannot be null");
        return guard.run("withdrawEscrow", () -> {
            if (amount == null || amount.signum() <= 0) {
                throw new ValidationException(ValidationRule.INVALID_AMOUNT, "Withdrawal amount must be positive");
            }
            BalanceKey key = new BalanceKey(caller, currency);
            BigInteger balance = balances.getOrDefault(key, BigInteger.ZERO);
            if (amount.compareTo(balance) > 0) {
                throw new StateException("INSUFFICIENT_ESCROW_BALANCE",
                        "Escrow balance " + balance + " is below requested " + amount);
            }
            return payOut(caller, currency, amount);
        });
    }

    /**
     * Drains the caller's whole balance in the given currency. Returns zero
     * without paying anything when there is no balance.
     *
     * @throws TransferFailureException if the payout was not delivered
     */
    public BigInteger withdrawAll(Address caller, Address currency) {
        Objects.requireNonNull(caller, "Caller cannot be null");
        Objects.requireNonNull(currency, "Currency cannot be null");
        return guard.run("withdrawEscrow", () -> {
            BigInteger balance = balanceOf(caller, currency);
            if (balance.signum() == 0) {
                return BigInteger.ZERO;
            }
            return payOut(caller, currency, balance);
        });
    }

    private BigInteger payOut(Address caller, Address currency, BigInteger amount) {
        BalanceKey key = new BalanceKey(caller, currency);
        debit(key, amount);

        boolean paid;
        try {
            paid = payments.pay(caller, amount, currency);
        } catch (RuntimeException e) {
            log.warn("Escrow withdrawal payout to {} threw", caller, e);
            paid = false;
        }
        if (!paid) {
            balances.merge(key, amount, BigInteger::add);
            throw new TransferFailureException("ESCROW_WITHDRAWAL_FAILED",
                    "Escrow withdrawal of " + amount + " to " + caller + " failed");
        }

        eventBus.emit(new MarketplaceEvent(MarketplaceEventType.ESCROW_WITHDRAWAL, 0, caller, amount,
                clock.instant().getEpochSecond(), Map.of("currency", currency.value())));
        return amount;
    }

    private void debit(BalanceKey key, BigInteger amount) {
        balances.computeIfPresent(key, (k, current) -> {
            BigInteger left = current.subtract(amount);
            return left.signum() == 0 ? null : left;
        });
    }

    private record BalanceKey(Address beneficiary, Address currency) {}
}
