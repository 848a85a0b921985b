package com.flagship.payday.eventstore;

import lombok.Value;

/**
 * An event that has not been written yet. The store assigns sequence, global position
 * and recorded_at on append.
 */
@Value
public class NewEvent {
    String eventType;
    String eventVersion;
    String payload;
    EventMetadata metadata;

    public NewEvent(String eventType, String eventVersion, String payload, EventMetadata metadata) {
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("Event type is required");
        }
        if (payload == null) {
            throw new IllegalArgumentException("Event payload is required");
        }
        this.eventType = eventType;
        this.eventVersion = eventVersion;
        this.payload = payload;
        this.metadata = metadata;
    }
}
