package com.flagship.payday.eventstore;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Event log held in memory. Appends are serialized on a single monitor, which makes the
 * sequence check and the write one atomic step. Readers get a copy taken under the same monitor.
 */
@Repository
@ConditionalOnProperty(name = "payday.store.type", havingValue = "memory")
public class InMemoryEventStore implements EventStore {

    private final Clock clock;
    private final Object lock = new Object();
    private final Map<StreamKey, List<StoredEvent>> streams = new HashMap<>();
    private final List<StoredEvent> log = new ArrayList<>();

    public InMemoryEventStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public List<StoredEvent> append(String aggregateType, UUID aggregateId, long expectedLastSequence,
                                    List<NewEvent> events) {
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("Cannot append an empty batch");
        }

        synchronized (lock) {
            StreamKey key = new StreamKey(aggregateType, aggregateId);
            List<StoredEvent> stream = streams.computeIfAbsent(key, k -> new ArrayList<>());
            long actual = stream.size();
            if (actual != expectedLastSequence) {
                throw new ConcurrencyConflictException(aggregateType, aggregateId, expectedLastSequence, actual);
            }

            List<StoredEvent> stored = new ArrayList<>(events.size());
            long sequence = expectedLastSequence;
            for (NewEvent event : events) {
                sequence++;
                StoredEvent storedEvent = StoredEvent.builder()
                    .globalPosition(log.size() + 1L)
                    .aggregateType(aggregateType)
                    .aggregateId(aggregateId)
                    .sequence(sequence)
                    .eventType(event.getEventType())
                    .eventVersion(event.getEventVersion())
                    .payload(event.getPayload())
                    .metadata(event.getMetadata())
                    .recordedAt(clock.instant())
                    .build();
                stream.add(storedEvent);
                log.add(storedEvent);
                stored.add(storedEvent);
            }
            return stored;
        }
    }

    @Override
    public Stream<StoredEvent> load(String aggregateType, UUID aggregateId, long afterSequence) {
        List<StoredEvent> copy;
        synchronized (lock) {
            List<StoredEvent> stream = streams.getOrDefault(new StreamKey(aggregateType, aggregateId), List.of());
            int from = (int) Math.min(Math.max(afterSequence, 0), stream.size());
            copy = new ArrayList<>(stream.subList(from, stream.size()));
        }
        return copy.stream();
    }

    @Override
    public Stream<StoredEvent> loadAllSince(long afterPosition, int maxEvents) {
        List<StoredEvent> copy;
        synchronized (lock) {
            int from = (int) Math.min(Math.max(afterPosition, 0), log.size());
            int to = (int) Math.min((long) from + maxEvents, log.size());
            copy = new ArrayList<>(log.subList(from, to));
        }
        return copy.stream();
    }

    @Override
    public long lastSequence(String aggregateType, UUID aggregateId) {
        synchronized (lock) {
            return streams.getOrDefault(new StreamKey(aggregateType, aggregateId), List.of()).size();
        }
    }

    @Override
    public long lastGlobalPosition() {
        synchronized (lock) {
            return log.size();
        }
    }

    private record StreamKey(String aggregateType, UUID aggregateId) {}
}
