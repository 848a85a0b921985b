package com.flagship.payday.command;

import com.flagship.payday.eventstore.StoredEvent;
import com.flagship.payday.payment.PaymentAggregate;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of a handled command. A no-op leaves the stream untouched; {@code anomaly} says why.
 */
@Value
public class CommandResult {
    UUID aggregateId;
    PaymentAggregate state;
    List<StoredEvent> appended;
    boolean noop;
    String anomaly;

    public static CommandResult applied(PaymentAggregate state, List<StoredEvent> appended) {
        return new CommandResult(state.getId(), state, List.copyOf(appended), false, null);
    }

    public static CommandResult noop(PaymentAggregate state, String anomaly) {
        return new CommandResult(state.getId(), state, List.of(), true, anomaly);
    }
}
