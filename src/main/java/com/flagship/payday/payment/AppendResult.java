package com.flagship.payday.payment;

import com.flagship.payday.eventstore.StoredEvent;
import lombok.Value;

import java.util.List;

/**
 * Outcome of {@link PaymentAggregateRepository#append}: the events written and the state after
 * them, or nothing written with the anomaly that made the batch a no-op.
 */
@Value
public class AppendResult {
    PaymentAggregate state;
    List<StoredEvent> stored;
    String anomaly;

    public static AppendResult written(PaymentAggregate state, List<StoredEvent> stored) {
        return new AppendResult(state, List.copyOf(stored), null);
    }

    public static AppendResult ignored(PaymentAggregate state, String anomaly) {
        return new AppendResult(state, List.of(), anomaly);
    }

    public boolean isIgnored() {
        return stored.isEmpty();
    }
}
