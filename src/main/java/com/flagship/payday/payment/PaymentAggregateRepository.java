package com.flagship.payday.payment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.payday.eventstore.EventMetadata;
import com.flagship.payday.eventstore.EventStore;
import com.flagship.payday.eventstore.NewEvent;
import com.flagship.payday.eventstore.StoredEvent;
import com.flagship.payday.payment.event.PaymentEvent;
import com.flagship.payday.snapshot.Snapshot;
import com.flagship.payday.snapshot.SnapshotStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads payment aggregates from snapshot plus event tail and appends new events to their stream.
 *
 * Snapshots are best-effort: a snapshot that cannot be read or written is logged and the
 * aggregate is rebuilt from the log instead.
 */
@Service
@Slf4j
public class PaymentAggregateRepository {

    private final EventStore eventStore;
    private final SnapshotStore snapshotStore;
    private final PaymentReducer reducer;
    private final PaymentEventCodec codec;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int snapshotFrequency;

    public PaymentAggregateRepository(EventStore eventStore,
                                      SnapshotStore snapshotStore,
                                      PaymentReducer reducer,
                                      PaymentEventCodec codec,
                                      ObjectMapper objectMapper,
                                      Clock clock,
                                      @Value("${payday.snapshot.frequency:10}") int snapshotFrequency) {
        this.eventStore = eventStore;
        this.snapshotStore = snapshotStore;
        this.reducer = reducer;
        this.codec = codec;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.snapshotFrequency = snapshotFrequency;
    }

    /**
     * Current state of the aggregate. Never null: an unknown id yields an empty aggregate.
     *
     * @throws InvalidTransitionException if the stored stream does not replay
     */
    public PaymentAggregate load(UUID id) {
        PaymentAggregate state = loadSnapshot(id).orElseGet(() -> PaymentAggregate.empty(id));

        try (Stream<StoredEvent> events = eventStore.load(PaymentAggregate.AGGREGATE_TYPE, id, state.getVersion())) {
            for (StoredEvent stored : (Iterable<StoredEvent>) events::iterator) {
                state = replay(state, stored);
            }
        }
        return state;
    }

    /**
     * Full event history of one stream, oldest first.
     */
    public List<StoredEvent> history(UUID id) {
        try (Stream<StoredEvent> events = eventStore.load(PaymentAggregate.AGGREGATE_TYPE, id, 0)) {
            return events.collect(Collectors.toList());
        }
    }

    /**
     * Validates the events against {@code current} and appends them at
     * {@code current.version + 1}.
     *
     * If the reducer ignores any event nothing is written and the anomaly is returned.
     *
     * @throws InvalidTransitionException if an event is not allowed in the current state
     * @throws com.flagship.payday.eventstore.ConcurrencyConflictException if the stream moved past {@code current}
     */
    public AppendResult append(PaymentAggregate current, List<? extends PaymentEvent> events, EventMetadata metadata) {
        PaymentAggregate next = current;
        List<NewEvent> encoded = new ArrayList<>(events.size());
        long sequence = current.getVersion();
        for (PaymentEvent event : events) {
            sequence++;
            Transition transition = reducer.apply(next, event, sequence);
            if (transition.isIgnored()) {
                log.warn("Not appending {} to payment {}: {}", event.getEventType(), current.getId(),
                    transition.getAnomaly());
                return AppendResult.ignored(current, transition.getAnomaly());
            }
            next = transition.getState();
            encoded.add(codec.encode(event, metadata));
        }

        List<StoredEvent> stored = eventStore.append(PaymentAggregate.AGGREGATE_TYPE, current.getId(),
            current.getVersion(), encoded);

        for (StoredEvent event : stored) {
            log.info("Appended {} to payment {} at sequence {}: status={}", event.getEventType(),
                event.getAggregateId(), event.getSequence(), next.getStatus());
        }

        maybeSnapshot(current.getVersion(), next);
        return AppendResult.written(next, stored);
    }

    private PaymentAggregate replay(PaymentAggregate state, StoredEvent stored) {
        PaymentEvent event = codec.decode(stored);
        Transition transition = reducer.apply(state, event, stored.getSequence());
        if (transition.isIgnored()) {
            log.warn("Ignored {} at payment {}#{} during replay: {}", stored.getEventType(),
                stored.getAggregateId(), stored.getSequence(), transition.getAnomaly());
        }
        return transition.getState();
    }

    private Optional<PaymentAggregate> loadSnapshot(UUID id) {
        try {
            Optional<Snapshot> snapshot = snapshotStore.loadLatest(PaymentAggregate.AGGREGATE_TYPE, id);
            if (snapshot.isEmpty()) {
                return Optional.empty();
            }
            PaymentAggregate state = objectMapper.readValue(snapshot.get().getPayload(), PaymentAggregate.class);
            if (state.getVersion() != snapshot.get().getLastSequence()) {
                log.warn("Discarding snapshot of payment {}: version {} does not match last sequence {}",
                    id, state.getVersion(), snapshot.get().getLastSequence());
                return Optional.empty();
            }
            return Optional.of(state);
        } catch (Exception e) {
            log.warn("Failed to load snapshot of payment {}, replaying from the log: {}", id, e.getMessage());
            return Optional.empty();
        }
    }

    private void maybeSnapshot(long previousVersion, PaymentAggregate state) {
        if (snapshotFrequency <= 0 || state.getVersion() / snapshotFrequency == previousVersion / snapshotFrequency) {
            return;
        }
        try {
            snapshotStore.save(Snapshot.of(PaymentAggregate.AGGREGATE_TYPE, state.getId(), state.getVersion(),
                objectMapper.writeValueAsString(state), clock.instant()));
            log.debug("Saved snapshot of payment {} at version {}", state.getId(), state.getVersion());
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Failed to save snapshot of payment {} at version {}: {}", state.getId(),
                state.getVersion(), e.getMessage());
        }
    }
}
