package com.flagship.payday.eventstore;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Context stored next to every event: who caused it and where it came from.
 */
@Value
@Builder
@Jacksonized
public class EventMetadata {

    public static final String SOURCE_API = "api";
    public static final String SOURCE_RECONCILER = "reconciler";
    public static final String SOURCE_SCHEDULER = "scheduler";

    String correlationId;
    String source;
    String nodeId;

    public static EventMetadata of(String correlationId, String source) {
        return new EventMetadata(correlationId, source, null);
    }

    public EventMetadata withNodeId(String nodeId) {
        return new EventMetadata(correlationId, source, nodeId);
    }
}
