package com.flagship.payday.payment;

import com.flagship.payday.eventstore.EventMetadata;
import com.flagship.payday.eventstore.StoredEvent;
import com.flagship.payday.payment.event.InvoiceCreated;
import com.flagship.payday.payment.event.InvoicePaymentDetected;
import com.flagship.payday.payment.event.InvoiceSettled;
import com.flagship.payday.snapshot.Snapshot;
import com.flagship.payday.snapshot.SnapshotStore;
import com.flagship.payday.support.PaydayTestHarness;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PaymentAggregateRepositoryTest {

    private static final EventMetadata METADATA = EventMetadata.of("corr-1", EventMetadata.SOURCE_API);
    private static final Instant NOW = PaydayTestHarness.START;

    private static InvoiceCreated onChainInvoice(long sats) {
        return InvoiceCreated.builder()
            .method(SettlementMethod.ON_CHAIN)
            .amount(Amount.sats(sats))
            .expiresAt(NOW.plusSeconds(3600))
            .nodeId("sim-onchain")
            .nodeReference("bcrt1qaddr")
            .paymentRequest("bcrt1qaddr")
            .createdAt(NOW)
            .build();
    }

    private static InvoicePaymentDetected detected(String txid) {
        return InvoicePaymentDetected.builder()
            .amount(Amount.sats(1_000)).transactionId(txid).confirmations(0).detectedAt(NOW).build();
    }

    @Test
    @DisplayName("Unknown id loads as an empty aggregate")
    void unknownIdIsEmpty() {
        PaydayTestHarness harness = new PaydayTestHarness();
        UUID id = UUID.randomUUID();

        PaymentAggregate state = harness.repository.load(id);

        assertTrue(state.isEmpty());
        assertEquals(id, state.getId());
        assertEquals(0, state.getVersion());
    }

    @Test
    @DisplayName("Appended events are stored with metadata and replay to the same state")
    void appendThenLoad() {
        PaydayTestHarness harness = new PaydayTestHarness();
        UUID id = UUID.randomUUID();

        AppendResult result = harness.repository.append(PaymentAggregate.empty(id),
            List.of(onChainInvoice(1_000)), METADATA);

        assertFalse(result.isIgnored());
        assertEquals(1, result.getStored().size());
        StoredEvent stored = result.getStored().get(0);
        assertEquals(InvoiceCreated.EVENT_TYPE, stored.getEventType());
        assertEquals("1.0.0", stored.getEventVersion());
        assertEquals("corr-1", stored.getMetadata().getCorrelationId());

        assertEquals(result.getState(), harness.repository.load(id));
        assertEquals(1, harness.repository.history(id).size());
    }

    @Test
    @DisplayName("An ignored event is not written and reports the anomaly")
    void ignoredEventNotWritten() {
        PaydayTestHarness harness = new PaydayTestHarness();
        UUID id = UUID.randomUUID();
        PaymentAggregate created = harness.repository.append(PaymentAggregate.empty(id),
            List.of(onChainInvoice(1_000), detected("tx-1")), METADATA).getState();

        AppendResult result = harness.repository.append(created, List.of(detected("tx-1")), METADATA);

        assertTrue(result.isIgnored());
        assertNotNull(result.getAnomaly());
        assertEquals(2, harness.eventStore.lastSequence(PaymentAggregate.AGGREGATE_TYPE, id));
    }

    @Test
    @DisplayName("Invalid events are rejected before anything is written")
    void invalidEventRejected() {
        PaydayTestHarness harness = new PaydayTestHarness();
        UUID id = UUID.randomUUID();

        assertThrows(InvalidTransitionException.class, () -> harness.repository.append(PaymentAggregate.empty(id),
            List.of(InvoiceSettled.builder().amountSettled(Amount.sats(1)).settledAt(NOW).build()), METADATA));
        assertEquals(0, harness.eventStore.lastGlobalPosition());
    }

    @Test
    @DisplayName("A snapshot is taken every N events and loading from it matches a full replay")
    void snapshotMatchesReplay() {
        PaydayTestHarness harness = new PaydayTestHarness(null, null, 2);
        UUID id = UUID.randomUUID();

        PaymentAggregate state = harness.repository.append(PaymentAggregate.empty(id),
            List.of(onChainInvoice(5_000)), METADATA).getState();
        state = harness.repository.append(state, List.of(detected("tx-1")), METADATA).getState();
        state = harness.repository.append(state, List.of(detected("tx-2")), METADATA).getState();

        Optional<Snapshot> snapshot = harness.snapshotStore.loadLatest(PaymentAggregate.AGGREGATE_TYPE, id);
        assertTrue(snapshot.isPresent());
        assertEquals(2, snapshot.get().getLastSequence());
        assertEquals(1, snapshot.get().getCurrentSnapshot());

        PaydayTestHarness withoutSnapshots = new PaydayTestHarness(harness.eventStore, null, 0);
        assertEquals(withoutSnapshots.repository.load(id), harness.repository.load(id));
        assertEquals(state, harness.repository.load(id));
        assertEquals("tx-2", state.getTransactionId());
    }

    @Test
    @DisplayName("Each later snapshot of an aggregate gets the next revision")
    void snapshotRevisionsIncrease() {
        PaydayTestHarness harness = new PaydayTestHarness(null, null, 2);
        UUID id = UUID.randomUUID();

        PaymentAggregate state = harness.repository.append(PaymentAggregate.empty(id),
            List.of(onChainInvoice(5_000)), METADATA).getState();
        for (String txid : List.of("tx-1", "tx-2", "tx-3")) {
            state = harness.repository.append(state, List.of(detected(txid)), METADATA).getState();
        }
        harness.snapshotStore.save(Snapshot.of(PaymentAggregate.AGGREGATE_TYPE, id, 2, "{}", NOW));

        Snapshot latest = harness.snapshotStore.loadLatest(PaymentAggregate.AGGREGATE_TYPE, id).orElseThrow();
        assertEquals(4, latest.getLastSequence());
        assertEquals(2, latest.getCurrentSnapshot());
    }

    @Test
    @DisplayName("Snapshot failures do not fail the append")
    void snapshotFailureSwallowed() {
        SnapshotStore failing = mock(SnapshotStore.class);
        when(failing.loadLatest(any(), any())).thenReturn(Optional.empty());
        doThrow(new IllegalStateException("disk full")).when(failing).save(any());
        PaydayTestHarness harness = new PaydayTestHarness(null, failing, 1);
        UUID id = UUID.randomUUID();

        AppendResult result = harness.repository.append(PaymentAggregate.empty(id),
            List.of(onChainInvoice(1_000)), METADATA);

        assertEquals(1, result.getState().getVersion());
        verify(failing).save(any());
    }

    @Test
    @DisplayName("A corrupt snapshot falls back to replaying the log")
    void corruptSnapshotIgnored() {
        SnapshotStore corrupt = mock(SnapshotStore.class);
        PaydayTestHarness harness = new PaydayTestHarness(null, corrupt, 0);
        UUID id = UUID.randomUUID();
        when(corrupt.loadLatest(eq(PaymentAggregate.AGGREGATE_TYPE), eq(id)))
            .thenReturn(Optional.of(new Snapshot(PaymentAggregate.AGGREGATE_TYPE, id, 1, 1, "{not json", NOW)));

        harness.repository.append(PaymentAggregate.empty(id), List.of(onChainInvoice(1_000)), METADATA);

        assertEquals(PaymentStatus.AWAITING_PAYMENT, harness.repository.load(id).getStatus());
        verify(corrupt, never()).save(any());
    }
}
