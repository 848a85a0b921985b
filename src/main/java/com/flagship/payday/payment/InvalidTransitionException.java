package com.flagship.payday.payment;

import lombok.Getter;

import java.util.UUID;

/**
 * An event cannot be applied to the aggregate in its current state.
 *
 * Raised while deciding (the event is never written) and while replaying
 * (the stored stream is corrupt or was written by an incompatible version).
 */
@Getter
public class InvalidTransitionException extends RuntimeException {

    private final UUID aggregateId;
    private final long sequence;
    private final String eventType;
    private final PaymentStatus status;

    public InvalidTransitionException(UUID aggregateId, long sequence, String eventType,
                                      PaymentStatus status, String detail) {
        super(String.format("Cannot apply %s (sequence %d) to payment %s in status %s: %s",
            eventType, sequence, aggregateId, status != null ? status : "EMPTY", detail));
        this.aggregateId = aggregateId;
        this.sequence = sequence;
        this.eventType = eventType;
        this.status = status;
    }
}
