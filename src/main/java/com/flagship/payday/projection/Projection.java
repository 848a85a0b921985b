package com.flagship.payday.projection;

import com.flagship.payday.eventstore.StoredEvent;

/**
 * A consumer that tails the event log in global order.
 *
 * Delivery is at least once: after a crash the events since the last saved offset are handed
 * over again, so {@link #handle} must be idempotent.
 */
public interface Projection {

    /**
     * Stable name; also the id of the projection's offset.
     */
    String name();

    void handle(StoredEvent event);
}
