package com.flagship.payday.command;

import com.flagship.payday.eventstore.ConcurrencyConflictException;
import com.flagship.payday.eventstore.EventStore;
import com.flagship.payday.eventstore.InMemoryEventStore;
import com.flagship.payday.eventstore.NewEvent;
import com.flagship.payday.eventstore.StoredEvent;
import com.flagship.payday.node.NodeException;
import com.flagship.payday.node.NodeTimeoutException;
import com.flagship.payday.node.PaymentAttemptStatus;
import com.flagship.payday.payment.Amount;
import com.flagship.payday.payment.Currency;
import com.flagship.payday.payment.FailureReason;
import com.flagship.payday.payment.InvalidTransitionException;
import com.flagship.payday.payment.PaymentAggregate;
import com.flagship.payday.payment.PaymentStatus;
import com.flagship.payday.payment.SettlementMethod;
import com.flagship.payday.payment.event.InvoiceCreated;
import com.flagship.payday.payment.event.PaymentInitiated;
import com.flagship.payday.payment.event.PaymentSucceeded;
import com.flagship.payday.support.PaydayTestHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the command handler against in-memory stores and simulated nodes.
 *
 * These tests verify:
 * - Invoices are created at the node before InvoiceCreated is appended
 * - Outgoing payments append PaymentInitiated before the node is asked to pay
 * - Repeated commands are no-ops
 * - Node failures are recorded, or leave the stream untouched when nothing was appended yet
 * - Concurrency conflicts are retried a bounded number of times
 */
class PaymentCommandHandlerTest {

    private PaydayTestHarness harness;
    private PaymentCommandHandler handler;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
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
        handler = harness.commandHandler;
    }

    private CommandResult createInvoice(UUID id, SettlementMethod method, long sats) {
        return handler.handle(CreateInvoice.builder()
            .aggregateId(id)
            .method(method)
            .amount(Amount.sats(sats))
            .expiry(Duration.ofMinutes(30))
            .memo("order 42")
            .build());
    }

    /**
     * A payment request issued by some other node.
     */
    private String remoteRequest(String hash, long sats) {
        long expires = harness.clock.instant().plus(Duration.ofHours(1)).getEpochSecond();
        return String.join(":", "lnsim1", hash, Long.toString(sats), Long.toString(expires), "remote-node");
    }

    private CommandResult payLightning(UUID id, String request) {
        return handler.handle(PayInvoice.builder()
            .aggregateId(id)
            .method(SettlementMethod.LIGHTNING)
            .paymentRequest(request)
            .build());
    }

    private List<String> eventTypes(UUID id) {
        return harness.repository.history(id).stream().map(StoredEvent::getEventType).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Invoices")
    class Invoices {

        @Test
        @DisplayName("CreateInvoice asks the node for an invoice and appends InvoiceCreated")
        void createLightningInvoice() {
            printTestHeader("CreateInvoice asks the node for an invoice and appends InvoiceCreated");
            UUID id = UUID.randomUUID();
            printInput("Invoice", id + " / 25000 sats");

            CommandResult result = createInvoice(id, SettlementMethod.LIGHTNING, 25_000);
            PaymentAggregate state = result.getState();
            printOutput("State", state);

            assertFalse(result.isNoop());
            assertEquals(PaymentStatus.AWAITING_PAYMENT, state.getStatus());
            assertTrue(state.getPaymentRequest().startsWith("lnsim1:"));
            assertEquals("sim-lightning", state.getNodeId());
            assertEquals(harness.clock.instant().plus(Duration.ofMinutes(30)), state.getExpiresAt());
            assertEquals(List.of(InvoiceCreated.EVENT_TYPE), eventTypes(id));
            assertEquals("sim-lightning", result.getAppended().get(0).getMetadata().getNodeId());
            assertEquals(id, harness.references.findOwner(state.getNodeReference()).orElseThrow());

            printSuccess("Invoice created and payment hash registered");
        }

        @Test
        @DisplayName("On-chain invoices get a fresh address as their reference")
        void createOnChainInvoice() {
            UUID id = UUID.randomUUID();

            PaymentAggregate state = createInvoice(id, SettlementMethod.ON_CHAIN, 100_000).getState();

            assertTrue(state.getNodeReference().startsWith("bcrt1"));
            assertEquals(state.getNodeReference(), state.getPaymentRequest());
            assertEquals(id, harness.references.findOwner(state.getNodeReference()).orElseThrow());
        }

        @Test
        @DisplayName("Repeating CreateInvoice is a no-op")
        void createInvoiceIdempotent() {
            UUID id = UUID.randomUUID();
            PaymentAggregate first = createInvoice(id, SettlementMethod.LIGHTNING, 25_000).getState();

            CommandResult second = createInvoice(id, SettlementMethod.LIGHTNING, 25_000);

            assertTrue(second.isNoop());
            assertEquals(first, second.getState());
            assertEquals(1, harness.repository.history(id).size());
        }

        @Test
        @DisplayName("Node failure while creating an invoice appends nothing")
        void nodeFailureAppendsNothing() {
            UUID id = UUID.randomUUID();
            harness.lightningNode.failNextCall(new NodeException("sim-lightning", "connection refused"));

            assertThrows(NodeException.class, () -> createInvoice(id, SettlementMethod.LIGHTNING, 25_000));
            assertTrue(harness.repository.load(id).isEmpty());
        }

        @Test
        @DisplayName("Invalid amounts and currencies are rejected")
        void invalidAmountsRejected() {
            UUID id = UUID.randomUUID();

            assertThrows(CommandRejectedException.class, () -> createInvoice(id, SettlementMethod.LIGHTNING, 0));
            assertThrows(CommandRejectedException.class, () -> handler.handle(CreateInvoice.builder()
                .aggregateId(id)
                .method(SettlementMethod.LIGHTNING)
                .amount(new Amount(Currency.USD, 10))
                .build()));
            assertTrue(harness.repository.load(id).isEmpty());
        }

        @Test
        @DisplayName("Cancel works only while the invoice awaits payment")
        void cancelInvoice() {
            UUID id = UUID.randomUUID();
            createInvoice(id, SettlementMethod.LIGHTNING, 25_000);

            CommandResult canceled = handler.handle(new CancelInvoice(id, "customer left"));
            assertEquals(PaymentStatus.CANCELED, canceled.getState().getStatus());
            assertTrue(handler.handle(new CancelInvoice(id, "again")).isNoop());

            UUID settledId = UUID.randomUUID();
            createInvoice(settledId, SettlementMethod.LIGHTNING, 25_000);
            handler.handle(new SettleInvoice(settledId, Amount.sats(25_000), null));
            assertThrows(CommandRejectedException.class, () -> handler.handle(new CancelInvoice(settledId, null)));
        }

        @Test
        @DisplayName("Commands for unknown aggregates raise PaymentNotFoundException")
        void unknownAggregate() {
            UUID id = UUID.randomUUID();

            PaymentNotFoundException e = assertThrows(PaymentNotFoundException.class,
                () -> handler.handle(new CancelInvoice(id, null)));
            assertEquals(id, e.getAggregateId());
        }

        @Test
        @DisplayName("Expiry is rejected before expires_at and applied after it")
        void expireInvoice() {
            UUID id = UUID.randomUUID();
            createInvoice(id, SettlementMethod.LIGHTNING, 25_000);

            assertThrows(CommandRejectedException.class, () -> handler.handle(new ExpireInvoice(id)));

            harness.clock.advance(Duration.ofMinutes(31));
            assertEquals(PaymentStatus.EXPIRED, handler.handle(new ExpireInvoice(id)).getState().getStatus());
            assertTrue(handler.handle(new ExpireInvoice(id)).isNoop());
        }

        @Test
        @DisplayName("A settlement after expiry is a no-op with an anomaly")
        void settlementAfterExpiryIsAnomaly() {
            UUID id = UUID.randomUUID();
            createInvoice(id, SettlementMethod.LIGHTNING, 25_000);
            harness.clock.advance(Duration.ofHours(1));
            handler.handle(new ExpireInvoice(id));

            CommandResult late = handler.handle(new SettleInvoice(id, Amount.sats(25_000), null));

            assertTrue(late.isNoop());
            assertNotNull(late.getAnomaly());
            assertEquals(PaymentStatus.EXPIRED, late.getState().getStatus());
            assertEquals(1.0, harness.meterRegistry.counter("payday.anomalies", "event_type", "InvoiceSettled").count());
        }

        @Test
        @DisplayName("Underpaid settlement fails the invoice")
        void underpaidSettlement() {
            UUID id = UUID.randomUUID();
            createInvoice(id, SettlementMethod.LIGHTNING, 25_000);

            PaymentAggregate state = handler.handle(new SettleInvoice(id, Amount.sats(20_000), null)).getState();

            assertEquals(PaymentStatus.FAILED, state.getStatus());
            assertEquals(FailureReason.UNDERPAID, state.getFailureReason());
        }
    }

    @Nested
    @DisplayName("Outgoing payments")
    class OutgoingPayments {

        @Test
        @DisplayName("Successful Lightning payment appends PaymentInitiated then PaymentSucceeded")
        void lightningPaymentSucceeds() {
            printTestHeader("Successful Lightning payment appends PaymentInitiated then PaymentSucceeded");
            UUID id = UUID.randomUUID();
            String request = remoteRequest("hash-ok", 40_000);
            printInput("Payment request", request);

            CommandResult result = payLightning(id, request);
            printOutput("State", result.getState());

            assertEquals(PaymentStatus.SETTLED, result.getState().getStatus());
            assertEquals(Amount.sats(40_000), result.getState().getAmountSettled());
            assertEquals(Amount.sats(40), result.getState().getFee());
            assertEquals(List.of(PaymentInitiated.EVENT_TYPE, PaymentSucceeded.EVENT_TYPE), eventTypes(id));
            assertEquals(2, result.getAppended().size());

            printSuccess("Payment settled with fee");
        }

        @Test
        @DisplayName("Repeating PayInvoice does not pay twice")
        void payInvoiceIdempotent() {
            UUID id = UUID.randomUUID();
            String request = remoteRequest("hash-once", 1_000);
            payLightning(id, request);

            CommandResult again = payLightning(id, request);

            assertTrue(again.isNoop());
            assertEquals(2, harness.repository.history(id).size());
        }

        @Test
        @DisplayName("Routing failure is recorded as PaymentFailed")
        void lightningPaymentFails() {
            UUID id = UUID.randomUUID();
            harness.lightningNode.nextPaymentOutcome(PaymentAttemptStatus.FAILED, FailureReason.ROUTE_NOT_FOUND);

            PaymentAggregate state = payLightning(id, remoteRequest("hash-noroute", 1_000)).getState();

            assertEquals(PaymentStatus.FAILED, state.getStatus());
            assertEquals(FailureReason.ROUTE_NOT_FOUND, state.getFailureReason());
        }

        @Test
        @DisplayName("A failed payment's request can be retried by a new payment")
        void failedPaymentCanBeRetried() {
            String request = remoteRequest("hash-retry", 1_000);
            harness.lightningNode.nextPaymentOutcome(PaymentAttemptStatus.FAILED, FailureReason.INSUFFICIENT_BALANCE);
            UUID first = UUID.randomUUID();
            payLightning(first, request);

            UUID second = UUID.randomUUID();
            PaymentAggregate retried = payLightning(second, request).getState();

            assertEquals(PaymentStatus.SETTLED, retried.getStatus());
            assertEquals(second, harness.references.findOwner("hash-retry").orElseThrow());
        }

        @Test
        @DisplayName("A request already being paid cannot be paid by another payment")
        void concurrentPaymentOfSameRequestRejected() {
            String request = remoteRequest("hash-busy", 1_000);
            harness.lightningNode.nextPaymentOutcome(PaymentAttemptStatus.IN_FLIGHT, null);
            payLightning(UUID.randomUUID(), request);

            UUID other = UUID.randomUUID();
            assertThrows(CommandRejectedException.class, () -> payLightning(other, request));
            assertTrue(harness.repository.load(other).isEmpty());
        }

        @Test
        @DisplayName("Timeout from the node is resolved by a status query")
        void timeoutResolvedByStatusQuery() {
            printTestHeader("Timeout from the node is resolved by a status query");
            UUID id = UUID.randomUUID();
            harness.lightningNode.failNextCall(new NodeTimeoutException("sim-lightning", "no response in 30s"));

            PaymentAggregate state = payLightning(id, remoteRequest("hash-timeout", 2_000)).getState();
            printOutput("State", state);

            assertEquals(PaymentStatus.SETTLED, state.getStatus());
            printSuccess("Status query found the payment settled");
        }

        @Test
        @DisplayName("Timeout with an unreachable node records PaymentFailed with TIMEOUT")
        void timeoutWithoutStatusRecordsFailure() {
            UUID id = UUID.randomUUID();
            harness.lightningNode.failNextCall(new NodeTimeoutException("sim-lightning", "no response in 30s"));
            harness.lightningNode.failNextCall(new NodeException("sim-lightning", "connection reset"));

            PaymentAggregate state = payLightning(id, remoteRequest("hash-lost", 2_000)).getState();

            assertEquals(PaymentStatus.FAILED, state.getStatus());
            assertEquals(FailureReason.TIMEOUT, state.getFailureReason());
        }

        @Test
        @DisplayName("In-flight payments settle through RecordPaymentOutcome; duplicates are no-ops, contradictions rejected")
        void inFlightResolvedLater() {
            UUID id = UUID.randomUUID();
            harness.lightningNode.nextPaymentOutcome(PaymentAttemptStatus.IN_FLIGHT, null);
            assertEquals(PaymentStatus.IN_FLIGHT, payLightning(id, remoteRequest("hash-slow", 3_000)).getState().getStatus());

            RecordPaymentOutcome succeeded = RecordPaymentOutcome.builder()
                .aggregateId(id)
                .status(PaymentAttemptStatus.SUCCEEDED)
                .amount(Amount.sats(3_000))
                .fee(Amount.sats(3))
                .build();
            assertEquals(PaymentStatus.SETTLED, handler.handle(succeeded).getState().getStatus());
            assertTrue(handler.handle(succeeded).isNoop());

            assertThrows(InvalidTransitionException.class, () -> handler.handle(RecordPaymentOutcome.builder()
                .aggregateId(id)
                .status(PaymentAttemptStatus.FAILED)
                .failureReason(FailureReason.ROUTE_NOT_FOUND)
                .build()));
        }

        @Test
        @DisplayName("Expired or malformed payment requests are rejected before anything is appended")
        void badRequestsRejected() {
            UUID id = UUID.randomUUID();
            String expired = String.join(":", "lnsim1", "hash-old", "1000",
                Long.toString(harness.clock.instant().minusSeconds(1).getEpochSecond()), "remote-node");

            assertThrows(CommandRejectedException.class, () -> payLightning(id, expired));
            assertThrows(CommandRejectedException.class, () -> payLightning(id, "not-a-request"));
            assertThrows(CommandRejectedException.class, () -> handler.handle(PayInvoice.builder()
                .aggregateId(id)
                .method(SettlementMethod.LIGHTNING)
                .paymentRequest(remoteRequest("hash-amt", 1_000))
                .amount(Amount.sats(999))
                .build()));
            assertTrue(harness.repository.load(id).isEmpty());
        }

        @Test
        @DisplayName("On-chain payment is broadcast and stays in flight with its txid")
        void onChainPayment() {
            UUID id = UUID.randomUUID();

            PaymentAggregate state = handler.handle(PayInvoice.builder()
                .aggregateId(id)
                .method(SettlementMethod.ON_CHAIN)
                .destination("bcrt1qremote")
                .amount(Amount.sats(70_000))
                .build()).getState();

            assertEquals(PaymentStatus.IN_FLIGHT, state.getStatus());
            assertNotNull(state.getTransactionId());
            assertEquals(id, harness.references.findOwner(state.getTransactionId()).orElseThrow());
        }

        @Test
        @DisplayName("On-chain broadcast failure is recorded as PaymentFailed")
        void onChainBroadcastFailure() {
            UUID id = UUID.randomUUID();

            PaymentAggregate state = handler.handle(PayInvoice.builder()
                .aggregateId(id)
                .method(SettlementMethod.ON_CHAIN)
                .destination("not-an-address")
                .amount(Amount.sats(70_000))
                .build()).getState();

            assertEquals(PaymentStatus.FAILED, state.getStatus());
            assertEquals(FailureReason.NODE_ERROR, state.getFailureReason());
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("A conflicting append is retried after reloading")
        void conflictRetried() {
            ConflictingEventStore store = new ConflictingEventStore(new InMemoryEventStore(harness.clock));
            PaydayTestHarness conflicting = new PaydayTestHarness(store, null, 10);
            UUID id = UUID.randomUUID();
            conflicting.commandHandler.handle(CreateInvoice.builder()
                .aggregateId(id).method(SettlementMethod.LIGHTNING).amount(Amount.sats(5_000)).build());

            store.failNext(1);
            CommandResult result = conflicting.commandHandler.handle(new CancelInvoice(id, "retry"));

            assertEquals(PaymentStatus.CANCELED, result.getState().getStatus());
            assertEquals(1.0, conflicting.meterRegistry.counter("payday.command.conflicts").count());
        }

        @Test
        @DisplayName("Exhausted retries raise CommandConflictException")
        void conflictRetriesExhausted() {
            ConflictingEventStore store = new ConflictingEventStore(new InMemoryEventStore(harness.clock));
            PaydayTestHarness conflicting = new PaydayTestHarness(store, null, 10);
            UUID id = UUID.randomUUID();
            conflicting.commandHandler.handle(CreateInvoice.builder()
                .aggregateId(id).method(SettlementMethod.LIGHTNING).amount(Amount.sats(5_000)).build());

            store.failNext(3);
            CommandConflictException e = assertThrows(CommandConflictException.class,
                () -> conflicting.commandHandler.handle(new CancelInvoice(id, "retry")));

            assertEquals(3, e.getAttempts());
            assertEquals(PaymentStatus.AWAITING_PAYMENT, conflicting.repository.load(id).getStatus());
        }
    }

    /**
     * Event store that reports a concurrent writer for the next N appends.
     */
    private static class ConflictingEventStore implements EventStore {

        private final EventStore delegate;
        private final AtomicInteger failures = new AtomicInteger();

        ConflictingEventStore(EventStore delegate) {
            this.delegate = delegate;
        }

        void failNext(int count) {
            failures.set(count);
        }

        @Override
        public List<StoredEvent> append(String aggregateType, UUID aggregateId, long expectedLastSequence,
                                        List<NewEvent> events) {
            if (failures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                throw new ConcurrencyConflictException(aggregateType, aggregateId, expectedLastSequence, null);
            }
            return delegate.append(aggregateType, aggregateId, expectedLastSequence, events);
        }

        @Override
        public Stream<StoredEvent> load(String aggregateType, UUID aggregateId, long afterSequence) {
            return delegate.load(aggregateType, aggregateId, afterSequence);
        }

        @Override
        public Stream<StoredEvent> loadAllSince(long afterPosition, int maxEvents) {
            return delegate.loadAllSince(afterPosition, maxEvents);
        }

        @Override
        public long lastSequence(String aggregateType, UUID aggregateId) {
            return delegate.lastSequence(aggregateType, aggregateId);
        }

        @Override
        public long lastGlobalPosition() {
            return delegate.lastGlobalPosition();
        }
    }
}
