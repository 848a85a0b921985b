package com.flagship.payday.snapshot;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Materialized aggregate state after {@code lastSequence} events.
 * Only valid as a starting point for events with a higher sequence.
 *
 * {@code currentSnapshot} is the revision of the snapshot within its aggregate: 1 for the first
 * snapshot stored, one more for each later one. The store assigns it; 0 means not stored yet.
 */
@Value
public class Snapshot {
    String aggregateType;
    UUID aggregateId;
    long lastSequence;
    long currentSnapshot;
    String payload;
    Instant createdAt;

    /**
     * A snapshot to hand to {@link SnapshotStore#save(Snapshot)}.
     */
    public static Snapshot of(String aggregateType, UUID aggregateId, long lastSequence, String payload,
                              Instant createdAt) {
        return new Snapshot(aggregateType, aggregateId, lastSequence, 0, payload, createdAt);
    }

    Snapshot withRevision(long revision) {
        return new Snapshot(aggregateType, aggregateId, lastSequence, revision, payload, createdAt);
    }
}
