package com.flagship.payday.offset;

import com.flagship.payday.eventstore.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Repository
@ConditionalOnProperty(name = "payday.store.type", havingValue = "jdbc", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class JdbcOffsetStore implements OffsetStore {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public long get(String id) {
        try {
            List<Long> offsets = jdbcTemplate.queryForList(
                "SELECT current_offset FROM offsets WHERE id = ?", Long.class, id);
            return offsets.isEmpty() ? 0L : offsets.get(0);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read offset " + id, e);
        }
    }

    @Override
    public boolean save(String id, long offset) {
        try {
            // The WHERE clause on the upsert keeps the offset monotonic under concurrent writers
            int updated = jdbcTemplate.update(
                "INSERT INTO offsets (id, current_offset, updated_at) VALUES (?, ?, CURRENT_TIMESTAMP) " +
                "ON CONFLICT (id) DO UPDATE SET current_offset = EXCLUDED.current_offset, updated_at = EXCLUDED.updated_at " +
                "WHERE offsets.current_offset < EXCLUDED.current_offset",
                id,
                offset
            );
            if (updated == 0) {
                long current = get(id);
                if (current > offset) {
                    log.warn("Ignoring attempt to move offset {} backwards: current={}, requested={}", id, current, offset);
                }
                return false;
            }
            return true;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to save offset " + id, e);
        }
    }

    @Override
    public Map<String, Long> findAll() {
        try {
            Map<String, Long> offsets = new LinkedHashMap<>();
            jdbcTemplate.query("SELECT id, current_offset FROM offsets ORDER BY id",
                (RowCallbackHandler) rs -> offsets.put(rs.getString("id"), rs.getLong("current_offset")));
            return offsets;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read offsets", e);
        }
    }
}
