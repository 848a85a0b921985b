package com.flagship.payday.payment.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * The invoice passed its expiry without being paid.
 */
@Value
@Builder
@Jacksonized
public class InvoiceExpired implements PaymentEvent {

    public static final String EVENT_TYPE = "InvoiceExpired";

    Instant expiredAt;

    @Override
    @JsonIgnore
    public String getEventType() {
        return EVENT_TYPE;
    }
}
