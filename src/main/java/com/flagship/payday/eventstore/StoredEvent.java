package com.flagship.payday.eventstore;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An event as persisted in the log. Immutable once written.
 */
@Value
@Builder
public class StoredEvent {
    long globalPosition;
    String aggregateType;
    UUID aggregateId;
    long sequence;
    String eventType;
    String eventVersion;
    String payload;
    EventMetadata metadata;
    Instant recordedAt;
}
