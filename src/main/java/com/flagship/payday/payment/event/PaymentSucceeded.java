package com.flagship.payday.payment.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.payday.payment.Amount;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * The outgoing payment completed.
 */
@Value
@Builder
@Jacksonized
public class PaymentSucceeded implements PaymentEvent {

    public static final String EVENT_TYPE = "PaymentSucceeded";

    Amount amount;
    Amount fee;
    String transactionId;
    Instant settledAt;

    @Override
    @JsonIgnore
    public String getEventType() {
        return EVENT_TYPE;
    }
}
