package com.flagship.payday.reconcile;

import com.flagship.payday.command.CancelInvoice;
import com.flagship.payday.command.CreateInvoice;
import com.flagship.payday.command.PayInvoice;
import com.flagship.payday.node.PaymentAttemptStatus;
import com.flagship.payday.node.notification.InvoiceSettlementNotification;
import com.flagship.payday.node.notification.OnChainTransactionNotification;
import com.flagship.payday.node.notification.PaymentStatusNotification;
import com.flagship.payday.payment.Amount;
import com.flagship.payday.payment.Currency;
import com.flagship.payday.payment.FailureReason;
import com.flagship.payday.payment.InvalidTransitionException;
import com.flagship.payday.payment.PaymentAggregate;
import com.flagship.payday.payment.PaymentDirection;
import com.flagship.payday.payment.PaymentStatus;
import com.flagship.payday.payment.SettlementMethod;
import com.flagship.payday.support.PaydayTestHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for matching node notifications to aggregates.
 *
 * These tests verify:
 * - Settlements and payment statuses reach the aggregate owning the node reference
 * - Redelivered notifications are no-ops
 * - Unknown references are reported as unmatched
 * - On-chain invoices move through pending to settled as blocks are mined
 */
class NodeReconcilerTest {

    private PaydayTestHarness harness;
    private NodeReconciler reconciler;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        harness = new PaydayTestHarness();
        reconciler = harness.reconciler;
    }

    private PaymentAggregate createInvoice(UUID id, SettlementMethod method, long sats) {
        return harness.commandHandler.handle(CreateInvoice.builder()
            .aggregateId(id)
            .method(method)
            .amount(Amount.sats(sats))
            .expiry(Duration.ofMinutes(30))
            .build()).getState();
    }

    @Test
    @DisplayName("Lightning settlement settles the owning invoice once")
    void settlementSettlesInvoice() {
        printTestHeader("Lightning settlement settles the owning invoice once");
        UUID id = UUID.randomUUID();
        PaymentAggregate invoice = createInvoice(id, SettlementMethod.LIGHTNING, 10_000);
        InvoiceSettlementNotification settlement =
            harness.lightningNode.settleInvoice(invoice.getNodeReference(), Amount.sats(12_000));

        assertEquals(ReconcileOutcome.APPLIED, reconciler.reconcile(settlement));
        assertEquals(ReconcileOutcome.NOOP, reconciler.reconcile(settlement));

        PaymentAggregate settled = harness.repository.load(id);
        printOutput("State", settled);
        assertEquals(PaymentStatus.SETTLED, settled.getStatus());
        assertTrue(settled.isOverpaid());
        assertEquals(2, harness.repository.history(id).size());
        assertEquals(1.0, harness.meterRegistry.counter("payday.reconciliations",
            "notification_type", "InvoiceSettlementNotification", "outcome", "noop").count());

        printSuccess("Duplicate settlement left the stream unchanged");
    }

    @Test
    @DisplayName("Notifications for unknown references are unmatched")
    void unknownReferenceUnmatched() {
        InvoiceSettlementNotification settlement = InvoiceSettlementNotification.builder()
            .paymentHash("nobody-registered-this")
            .amountSettled(Amount.sats(500))
            .settleIndex(1)
            .settledAt(harness.clock.instant())
            .build();

        assertEquals(ReconcileOutcome.UNMATCHED, reconciler.reconcile(settlement));
    }

    @Test
    @DisplayName("A registered reference without events is unmatched")
    void referenceWithoutEventsUnmatched() {
        harness.references.register("orphan-hash", UUID.randomUUID());

        assertEquals(ReconcileOutcome.UNMATCHED, reconciler.reconcile(PaymentStatusNotification.builder()
            .paymentHash("orphan-hash")
            .status(PaymentAttemptStatus.SUCCEEDED)
            .build()));
    }

    @Test
    @DisplayName("Settlement of a canceled invoice is recorded as an anomaly and ignored")
    void settlementAfterCancelIgnored() {
        UUID id = UUID.randomUUID();
        PaymentAggregate invoice = createInvoice(id, SettlementMethod.LIGHTNING, 10_000);
        harness.commandHandler.handle(new CancelInvoice(id, "changed mind"));

        ReconcileOutcome outcome = reconciler.reconcile(
            harness.lightningNode.settleInvoice(invoice.getNodeReference(), Amount.sats(10_000)));

        assertEquals(ReconcileOutcome.NOOP, outcome);
        assertEquals(PaymentStatus.CANCELED, harness.repository.load(id).getStatus());
    }

    @Test
    @DisplayName("On-chain invoice goes pending in the mempool and settles once confirmed")
    void onChainInvoiceSettlesOnConfirmation() {
        printTestHeader("On-chain invoice goes pending in the mempool and settles once confirmed");
        UUID id = UUID.randomUUID();
        PaymentAggregate invoice = createInvoice(id, SettlementMethod.ON_CHAIN, 50_000);
        harness.onChainNode.subscribeTransactions(0, reconciler::reconcile);

        String txid = harness.onChainNode.receive(invoice.getNodeReference(), Amount.sats(50_000));
        PaymentAggregate pending = harness.repository.load(id);
        printOutput("Pending", pending);
        assertEquals(PaymentStatus.AWAITING_PAYMENT, pending.getStatus());
        assertEquals(Amount.sats(50_000), pending.getAmountPending());
        assertEquals(txid, pending.getTransactionId());

        harness.onChainNode.mineBlock();
        PaymentAggregate settled = harness.repository.load(id);
        printOutput("Settled", settled);
        assertEquals(PaymentStatus.SETTLED, settled.getStatus());
        assertEquals(Amount.zero(Currency.BTC), settled.getAmountPending());

        // A further confirmation is a no-op
        harness.onChainNode.mineBlock();
        assertEquals(settled.getVersion(), harness.repository.load(id).getVersion());

        printSuccess("Invoice settled at one confirmation");
    }

    @Test
    @DisplayName("Outgoing on-chain payment succeeds once its transaction confirms")
    void outgoingOnChainConfirmed() {
        UUID id = UUID.randomUUID();
        PaymentAggregate sent = harness.commandHandler.handle(PayInvoice.builder()
            .aggregateId(id)
            .method(SettlementMethod.ON_CHAIN)
            .destination("bcrt1qremote")
            .amount(Amount.sats(30_000))
            .build()).getState();

        OnChainTransactionNotification unconfirmed = OnChainTransactionNotification.builder()
            .direction(PaymentDirection.OUTGOING)
            .address("bcrt1qremote")
            .transactionId(sent.getTransactionId())
            .amount(Amount.sats(30_000))
            .confirmations(0)
            .build();
        assertEquals(ReconcileOutcome.NOOP, reconciler.reconcile(unconfirmed));
        assertEquals(PaymentStatus.IN_FLIGHT, harness.repository.load(id).getStatus());

        OnChainTransactionNotification confirmed = unconfirmed.toBuilder().confirmations(1).blockHeight(1).build();
        assertEquals(ReconcileOutcome.APPLIED, reconciler.reconcile(confirmed));
        assertEquals(PaymentStatus.SETTLED, harness.repository.load(id).getStatus());
    }

    @Test
    @DisplayName("A status that contradicts the recorded outcome raises InvalidTransitionException")
    void contradictingStatusRejected() {
        UUID id = UUID.randomUUID();
        long expires = harness.clock.instant().plus(Duration.ofHours(1)).getEpochSecond();
        String request = String.join(":", "lnsim1", "hash-paid", "1000", Long.toString(expires), "remote-node");
        harness.commandHandler.handle(PayInvoice.builder()
            .aggregateId(id)
            .method(SettlementMethod.LIGHTNING)
            .paymentRequest(request)
            .build());

        PaymentStatusNotification failed = PaymentStatusNotification.builder()
            .paymentHash("hash-paid")
            .status(PaymentAttemptStatus.FAILED)
            .failureReason(FailureReason.ROUTE_NOT_FOUND)
            .build();

        assertThrows(InvalidTransitionException.class, () -> reconciler.reconcile(failed));
        assertEquals(PaymentStatus.SETTLED, harness.repository.load(id).getStatus());
    }

    @Test
    @DisplayName("UNKNOWN payment status is a no-op")
    void unknownStatusIsNoop() {
        assertEquals(ReconcileOutcome.NOOP, reconciler.reconcile(PaymentStatusNotification.builder()
            .paymentHash("whatever")
            .status(PaymentAttemptStatus.UNKNOWN)
            .build()));
    }
}
