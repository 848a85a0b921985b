package com.flagship.payday.payment.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * The merchant withdrew an unpaid invoice.
 */
@Value
@Builder
@Jacksonized
public class InvoiceCanceled implements PaymentEvent {

    public static final String EVENT_TYPE = "InvoiceCanceled";

    String reason;
    Instant canceledAt;

    @Override
    @JsonIgnore
    public String getEventType() {
        return EVENT_TYPE;
    }
}
