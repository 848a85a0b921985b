package com.flagship.payday.command;

import java.util.UUID;

public class PaymentNotFoundException extends CommandRejectedException {

    private final UUID aggregateId;

    public PaymentNotFoundException(UUID aggregateId) {
        super("Payment not found: " + aggregateId);
        this.aggregateId = aggregateId;
    }

    public UUID getAggregateId() {
        return aggregateId;
    }
}
