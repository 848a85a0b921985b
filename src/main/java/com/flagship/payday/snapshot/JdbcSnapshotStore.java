package com.flagship.payday.snapshot;

import com.flagship.payday.eventstore.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Snapshots in PostgreSQL. Each aggregate's snapshots are numbered by {@code current_snapshot},
 * ascending with {@code last_sequence}; the highest revision is the one loaded.
 */
@Repository
@ConditionalOnProperty(name = "payday.store.type", havingValue = "jdbc", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class JdbcSnapshotStore implements SnapshotStore {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Optional<Snapshot> loadLatest(String aggregateType, UUID aggregateId) {
        try {
            List<Snapshot> snapshots = jdbcTemplate.query(
                "SELECT aggregate_type, aggregate_id, last_sequence, current_snapshot, payload::text AS payload, created_at " +
                "FROM snapshots WHERE aggregate_type = ? AND aggregate_id = ? " +
                "ORDER BY current_snapshot DESC LIMIT 1",
                (rs, rowNum) -> {
                    Timestamp createdAt = rs.getTimestamp("created_at");
                    return new Snapshot(
                        rs.getString("aggregate_type"),
                        rs.getObject("aggregate_id", UUID.class),
                        rs.getLong("last_sequence"),
                        rs.getLong("current_snapshot"),
                        rs.getString("payload"),
                        createdAt != null ? createdAt.toInstant() : null
                    );
                },
                aggregateType,
                aggregateId
            );
            return snapshots.stream().findFirst();
        } catch (DataAccessException e) {
            throw new StorageException("Failed to load snapshot of " + aggregateType + "/" + aggregateId, e);
        }
    }

    /**
     * Stores the snapshot as the next revision, unless one at the same or a later sequence exists.
     */
    @Override
    public void save(Snapshot snapshot) {
        try {
            int inserted = jdbcTemplate.update(
                "INSERT INTO snapshots (aggregate_type, aggregate_id, last_sequence, current_snapshot, payload, created_at) " +
                "SELECT ?, ?, ?, COALESCE(MAX(current_snapshot), 0) + 1, ?::jsonb, CURRENT_TIMESTAMP " +
                "FROM snapshots WHERE aggregate_type = ? AND aggregate_id = ? " +
                "HAVING COALESCE(MAX(last_sequence), 0) < ?",
                snapshot.getAggregateType(),
                snapshot.getAggregateId(),
                snapshot.getLastSequence(),
                snapshot.getPayload(),
                snapshot.getAggregateType(),
                snapshot.getAggregateId(),
                snapshot.getLastSequence()
            );
            if (inserted == 0) {
                log.debug("Snapshot {}/{}@{} is not newer than the stored one", snapshot.getAggregateType(),
                    snapshot.getAggregateId(), snapshot.getLastSequence());
            }
        } catch (DuplicateKeyException e) {
            // Another writer stored a revision at the same time
            log.debug("Concurrent snapshot of {}/{} kept instead of @{}", snapshot.getAggregateType(),
                snapshot.getAggregateId(), snapshot.getLastSequence());
        } catch (DataAccessException e) {
            throw new StorageException("Failed to save snapshot of " + snapshot.getAggregateType() + "/"
                + snapshot.getAggregateId(), e);
        }
    }
}
