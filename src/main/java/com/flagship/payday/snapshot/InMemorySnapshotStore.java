package com.flagship.payday.snapshot;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps only the latest snapshot per aggregate, numbering revisions the way the relational store does.
 */
@Repository
@ConditionalOnProperty(name = "payday.store.type", havingValue = "memory")
public class InMemorySnapshotStore implements SnapshotStore {

    private final Map<String, Snapshot> latest = new ConcurrentHashMap<>();

    @Override
    public Optional<Snapshot> loadLatest(String aggregateType, UUID aggregateId) {
        return Optional.ofNullable(latest.get(key(aggregateType, aggregateId)));
    }

    @Override
    public void save(Snapshot snapshot) {
        latest.compute(key(snapshot.getAggregateType(), snapshot.getAggregateId()), (key, existing) -> {
            if (existing == null) {
                return snapshot.withRevision(1);
            }
            if (snapshot.getLastSequence() <= existing.getLastSequence()) {
                return existing;
            }
            return snapshot.withRevision(existing.getCurrentSnapshot() + 1);
        });
    }

    private static String key(String aggregateType, UUID aggregateId) {
        return aggregateType + ":" + aggregateId;
    }
}
