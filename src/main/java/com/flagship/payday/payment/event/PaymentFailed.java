package com.flagship.payday.payment.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.payday.payment.FailureReason;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * The outgoing payment failed permanently. A retry is a new payment.
 */
@Value
@Builder
@Jacksonized
public class PaymentFailed implements PaymentEvent {

    public static final String EVENT_TYPE = "PaymentFailed";

    FailureReason reason;
    String message;
    Instant failedAt;

    @Override
    @JsonIgnore
    public String getEventType() {
        return EVENT_TYPE;
    }
}
