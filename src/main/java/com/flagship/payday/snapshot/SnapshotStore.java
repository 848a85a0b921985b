package com.flagship.payday.snapshot;

import java.util.Optional;
import java.util.UUID;

/**
 * Cache of materialized aggregate state. Never a source of truth: losing every snapshot only
 * makes loads slower.
 */
public interface SnapshotStore {

    /**
     * The snapshot with the highest last sequence for the aggregate, if any.
     */
    Optional<Snapshot> loadLatest(String aggregateType, UUID aggregateId);

    /**
     * Stores a snapshot. Saving a snapshot that already exists for the same sequence is a no-op.
     */
    void save(Snapshot snapshot);
}
