package com.flagship.payday.eventstore;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * PostgreSQL event log.
 *
 * The primary key (aggregate_type, aggregate_id, sequence) is the concurrency guard. The last
 * sequence is also checked up front inside the same transaction so that stale writers fail fast
 * with the actual sequence in the exception; a writer that slips between the check and the insert
 * is caught by the key.
 */
@Repository
@ConditionalOnProperty(name = "payday.store.type", havingValue = "jdbc", matchIfMissing = true)
@Slf4j
public class JdbcEventStore implements EventStore {

    private static final String SELECT_COLUMNS =
        "SELECT global_position, aggregate_type, aggregate_id, sequence, event_type, event_version, " +
        "payload::text AS payload, metadata::text AS metadata, recorded_at FROM events ";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<StoredEvent> rowMapper = this::mapRow;

    public JdbcEventStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
                          ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<StoredEvent> append(String aggregateType, UUID aggregateId, long expectedLastSequence,
                                    List<NewEvent> events) {
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("Cannot append an empty batch");
        }

        try {
            return transactionTemplate.execute(status -> {
                long actual = lastSequence(aggregateType, aggregateId);
                if (actual != expectedLastSequence) {
                    throw new ConcurrencyConflictException(aggregateType, aggregateId, expectedLastSequence, actual);
                }

                List<StoredEvent> stored = new ArrayList<>(events.size());
                long sequence = expectedLastSequence;
                for (NewEvent event : events) {
                    sequence++;
                    stored.add(insert(aggregateType, aggregateId, sequence, event));
                }
                return stored;
            });
        } catch (DuplicateKeyException e) {
            log.info("Lost append race on {}/{} at sequence {}", aggregateType, aggregateId, expectedLastSequence + 1);
            throw new ConcurrencyConflictException(aggregateType, aggregateId, expectedLastSequence, null);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to append to " + aggregateType + "/" + aggregateId, e);
        }
    }

    private StoredEvent insert(String aggregateType, UUID aggregateId, long sequence, NewEvent event) {
        String metadata = writeMetadata(event.getMetadata());
        return jdbcTemplate.queryForObject(
            "INSERT INTO events (aggregate_type, aggregate_id, sequence, event_type, event_version, payload, metadata, recorded_at) " +
            "VALUES (?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, CURRENT_TIMESTAMP) " +
            "RETURNING global_position, aggregate_type, aggregate_id, sequence, event_type, event_version, " +
            "payload::text AS payload, metadata::text AS metadata, recorded_at",
            rowMapper,
            aggregateType,
            aggregateId,
            sequence,
            event.getEventType(),
            event.getEventVersion(),
            event.getPayload(),
            metadata
        );
    }

    @Override
    public Stream<StoredEvent> load(String aggregateType, UUID aggregateId, long afterSequence) {
        try {
            return jdbcTemplate.queryForStream(
                SELECT_COLUMNS + "WHERE aggregate_type = ? AND aggregate_id = ? AND sequence > ? ORDER BY sequence",
                rowMapper,
                aggregateType,
                aggregateId,
                afterSequence
            );
        } catch (DataAccessException e) {
            throw new StorageException("Failed to load " + aggregateType + "/" + aggregateId, e);
        }
    }

    @Override
    public Stream<StoredEvent> loadAllSince(long afterPosition, int maxEvents) {
        try {
            return jdbcTemplate.queryForStream(
                SELECT_COLUMNS + "WHERE global_position > ? ORDER BY global_position LIMIT ?",
                rowMapper,
                afterPosition,
                maxEvents
            );
        } catch (DataAccessException e) {
            throw new StorageException("Failed to load events after position " + afterPosition, e);
        }
    }

    @Override
    public long lastSequence(String aggregateType, UUID aggregateId) {
        try {
            Long last = jdbcTemplate.queryForObject(
                "SELECT COALESCE(MAX(sequence), 0) FROM events WHERE aggregate_type = ? AND aggregate_id = ?",
                Long.class,
                aggregateType,
                aggregateId
            );
            return last != null ? last : 0L;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read last sequence of " + aggregateType + "/" + aggregateId, e);
        }
    }

    @Override
    public long lastGlobalPosition() {
        try {
            Long last = jdbcTemplate.queryForObject("SELECT COALESCE(MAX(global_position), 0) FROM events", Long.class);
            return last != null ? last : 0L;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read last global position", e);
        }
    }

    private StoredEvent mapRow(ResultSet rs, int rowNum) throws SQLException {
        Timestamp recordedAt = rs.getTimestamp("recorded_at");
        return StoredEvent.builder()
            .globalPosition(rs.getLong("global_position"))
            .aggregateType(rs.getString("aggregate_type"))
            .aggregateId(rs.getObject("aggregate_id", UUID.class))
            .sequence(rs.getLong("sequence"))
            .eventType(rs.getString("event_type"))
            .eventVersion(rs.getString("event_version"))
            .payload(rs.getString("payload"))
            .metadata(readMetadata(rs.getString("metadata")))
            .recordedAt(recordedAt != null ? recordedAt.toInstant() : null)
            .build();
    }

    private String writeMetadata(EventMetadata metadata) {
        if (metadata == null) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize event metadata", e);
        }
    }

    private EventMetadata readMetadata(String json) throws SQLException {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, EventMetadata.class);
        } catch (JsonProcessingException e) {
            throw new SQLException("Unreadable event metadata: " + json, e);
        }
    }
}
