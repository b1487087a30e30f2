package com.auctionhouse.engine.escrow;

import com.auctionhouse.core.domain.Address;
import com.auctionhouse.core.error.StateException;
import com.auctionhouse.core.error.TransferFailureException;
import com.auctionhouse.engine.event.EventBus;
import com.auctionhouse.engine.event.MarketplaceEvent;
import com.auctionhouse.engine.event.MarketplaceEventType;
import com.auctionhouse.engine.support.MutableClock;
import com.auctionhouse.engine.support.OperationGuard;
import com.auctionhouse.engine.support.RecordingPaymentProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class EscrowLedgerTest {

    private static final Address ALICE = Address.of("0x00000000000000000000000000000000000000a1");
    private static final Address BOB = Address.of("0x00000000000000000000000000000000000000b2");
    private static final Address TOKEN = Address.of("0x00000000000000000000000000000000000000c3");

    private RecordingPaymentProvider payments;
    private EscrowLedger ledger;
    private final List<MarketplaceEvent> events = new ArrayList<>();

    @BeforeEach
    void setUp() {
        payments = new RecordingPaymentProvider();
        EventBus bus = new EventBus();
        bus.subscribe(MarketplaceEventType.ESCROW_WITHDRAWAL, events::add);
        ledger = new EscrowLedger(payments, new OperationGuard(), bus, new MutableClock(1_000));
    }

    @Test
    void balancesAreKeptPerBeneficiaryAndCurrency() {
        ledger.credit(ALICE, Address.ZERO, BigInteger.TEN);
        ledger.credit(ALICE, Address.ZERO, BigInteger.ONE);
        ledger.credit(ALICE, TOKEN, BigInteger.TWO);
        ledger.credit(BOB, Address.ZERO, BigInteger.ZERO);

        assertThat(ledger.balanceOf(ALICE, Address.ZERO)).isEqualTo(BigInteger.valueOf(11));
        assertThat(ledger.balanceOf(ALICE, TOKEN)).isEqualTo(BigInteger.TWO);
        assertThat(ledger.balanceOf(BOB, Address.ZERO)).isZero();
    }

    @Test
    void withdrawDebitsAndPaysCaller() {
        ledger.credit(ALICE, Address.ZERO, BigInteger.TEN);

        ledger.withdraw(ALICE, Address.ZERO, BigInteger.valueOf(4));

        assertThat(ledger.balanceOf(ALICE, Address.ZERO)).isEqualTo(BigInteger.valueOf(6));
        assertThat(payments.paidTo(ALICE)).isEqualTo(BigInteger.valueOf(4));
        assertThat(events).singleElement().satisfies(e -> {
            assertThat(e.actor()).isEqualTo(ALICE);
            assertThat(e.amount()).isEqualTo(BigInteger.valueOf(4));
            assertThat(e.timestamp()).isEqualTo(1_000);
        });
    }

    @Test
    void withdrawAllDrainsBalanceOnce() {
        ledger.credit(ALICE, Address.ZERO, BigInteger.TEN);

        assertThat(ledger.withdrawAll(ALICE, Address.ZERO)).isEqualTo(BigInteger.TEN);

        assertThat(ledger.balanceOf(ALICE, Address.ZERO)).isZero();
        assertThat(ledger.withdrawAll(ALICE, Address.ZERO)).isZero();
        assertThat(ledger.withdrawAll(BOB, Address.ZERO)).isZero();
        assertThat(payments.paidTo(ALICE)).isEqualTo(BigInteger.TEN);
        assertThat(payments.paidTo(BOB)).isZero();
        assertThat(events).hasSize(1);
    }

    @Test
    void overdrawIsRejected() {
        ledger.credit(ALICE, Address.ZERO, BigInteger.TEN);

        assertThatThrownBy(() -> ledger.withdraw(ALICE, Address.ZERO, BigInteger.valueOf(11)))
                .isInstanceOf(StateException.class)
                .hasFieldOrPropertyWithValue("reason", "INSUFFICIENT_ESCROW_BALANCE");
        assertThatThrownBy(() -> ledger.withdraw(BOB, Address.ZERO, BigInteger.ONE))
                .isInstanceOf(StateException.class);
        assertThat(ledger.balanceOf(ALICE, Address.ZERO)).isEqualTo(BigInteger.TEN);
    }

    @Test
    void failedPayoutRestoresBalance() {
        ledger.credit(ALICE, Address.ZERO, BigInteger.TEN);
        payments.rejectPaymentsTo(ALICE);

        assertThatThrownBy(() -> ledger.withdraw(ALICE, Address.ZERO, BigInteger.TEN))
                .isInstanceOf(TransferFailureException.class)
                .hasFieldOrPropertyWithValue("reason", "ESCROW_WITHDRAWAL_FAILED");

        assertThat(ledger.balanceOf(ALICE, Address.ZERO)).isEqualTo(BigInteger.TEN);
        assertThat(events).isEmpty();
    }
}
