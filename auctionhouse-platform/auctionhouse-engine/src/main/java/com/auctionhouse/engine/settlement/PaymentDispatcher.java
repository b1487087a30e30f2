package com.auctionhouse.engine.settlement;

import com.auctionhouse.core.domain.Address;
import com.auctionhouse.core.spi.PaymentTransferProvider;
import com.auctionhouse.engine.escrow.EscrowLedger;
import com.auctionhouse.engine.settlement.SettlementReceipt.Disposition;
import com.auctionhouse.engine.settlement.SettlementReceipt.Payout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Sends money out of the marketplace. A payout that the provider rejects,
 * or that throws, is credited to the recipient's escrow balance so that one
 * uncooperative recipient never blocks a sale, finalization or refund.
 */
public class PaymentDispatcher {

    private static final Logger log = LoggerFactory.getLogger(PaymentDispatcher.class);

    private final PaymentTransferProvider payments;
    private final EscrowLedger escrowLedger;

    public PaymentDispatcher(PaymentTransferProvider payments, EscrowLedger escrowLedger) {
        this.payments = Objects.requireNonNull(payments, "Payment provider cannot be null");
        this.escrowLedger = Objects.requireNonNull(escrowLedger, "Escrow ledger cannot be null");
    }

    public Payout disburse(PayoutKind kind, Address recipient, BigInteger amount, Address currency) {
        if (amount.signum() <= 0) {
            return new Payout(kind, recipient, BigInteger.ZERO, Disposition.PAID);
        }
        boolean paid;
        try {
            paid = payments.pay(recipient, amount, currency);
        } catch (RuntimeException e) {
            log.warn("{} payout of {} to {} threw", kind, amount, recipient, e);
            paid = false;
        }
        if (paid) {
            return new Payout(kind, recipient, amount, Disposition.PAID);
        }
        log.warn("{} payout of {} to {} failed; crediting escrow", kind, amount, recipient);
        escrowLedger.credit(recipient, currency, amount);
        return new Payout(kind, recipient, amount, Disposition.ESCROWED);
    }
}
