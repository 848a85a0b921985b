package com.flagship.payday.offset;

import java.util.Map;

/**
 * Durable cursors for named consumers: projections and node subscriptions.
 *
 * Offsets only move forward. Saving a value lower than the stored one is ignored.
 */
public interface OffsetStore {

    /**
     * Stored offset, or 0 if the consumer has none yet.
     */
    long get(String id);

    /**
     * Moves the offset forward.
     *
     * @return false if the offset was not advanced (equal or lower than the stored value)
     */
    boolean save(String id, long offset);

    Map<String, Long> findAll();
}
