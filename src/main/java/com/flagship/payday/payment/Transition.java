package com.flagship.payday.payment;

import lombok.Value;

/**
 * Result of applying one event: either a new state, or the old state with an anomaly
 * when the event is tolerated but has no effect.
 *
 * An ignored transition still advances the version, since the event occupies a slot in the stream.
 */
@Value
public class Transition {
    PaymentAggregate state;
    boolean applied;
    String anomaly;

    public static Transition applied(PaymentAggregate state) {
        return new Transition(state, true, null);
    }

    public static Transition ignored(PaymentAggregate state, String anomaly) {
        return new Transition(state, false, anomaly);
    }

    public boolean isIgnored() {
        return !applied;
    }
}
