package com.flagship.payday.eventstore;

import lombok.Getter;

import java.util.UUID;

/**
 * Another writer appended to the stream first.
 * Recoverable: reload the aggregate and decide again.
 */
@Getter
public class ConcurrencyConflictException extends RuntimeException {

    private final String aggregateType;
    private final UUID aggregateId;
    private final long expectedSequence;
    private final Long actualSequence;

    public ConcurrencyConflictException(String aggregateType, UUID aggregateId,
                                        long expectedSequence, Long actualSequence) {
        super(String.format("Concurrent append to %s/%s: expected last sequence %d, found %s",
            aggregateType, aggregateId, expectedSequence,
            actualSequence != null ? actualSequence.toString() : "a newer write"));
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
        this.expectedSequence = expectedSequence;
        this.actualSequence = actualSequence;
    }
}
