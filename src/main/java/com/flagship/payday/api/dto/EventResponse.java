package com.flagship.payday.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import com.flagship.payday.eventstore.EventMetadata;
import com.flagship.payday.eventstore.StoredEvent;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One stored event of a payment's history. The payload is returned as recorded.
 */
@Value
@Builder
public class EventResponse {

    @JsonProperty("global_position")
    long globalPosition;

    @JsonProperty("sequence")
    long sequence;

    @JsonProperty("event_type")
    String eventType;

    @JsonProperty("event_version")
    String eventVersion;

    @JsonRawValue
    @JsonProperty("payload")
    String payload;

    @JsonProperty("metadata")
    EventMetadata metadata;

    @JsonProperty("recorded_at")
    Instant recordedAt;

    public static EventResponse from(StoredEvent event) {
        return EventResponse.builder()
            .globalPosition(event.getGlobalPosition())
            .sequence(event.getSequence())
            .eventType(event.getEventType())
            .eventVersion(event.getEventVersion())
            .payload(event.getPayload())
            .metadata(event.getMetadata())
            .recordedAt(event.getRecordedAt())
            .build();
    }
}
