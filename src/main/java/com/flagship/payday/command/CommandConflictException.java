package com.flagship.payday.command;

import java.util.UUID;

/**
 * Every attempt to append lost to a concurrent writer.
 */
public class CommandConflictException extends RuntimeException {

    private final UUID aggregateId;
    private final int attempts;

    public CommandConflictException(UUID aggregateId, int attempts, Throwable cause) {
        super(String.format("Gave up on payment %s after %d conflicting attempts", aggregateId, attempts), cause);
        this.aggregateId = aggregateId;
        this.attempts = attempts;
    }

    public UUID getAggregateId() {
        return aggregateId;
    }

    public int getAttempts() {
        return attempts;
    }
}
