package com.flagship.payday.payment.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.payday.payment.Amount;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * The node reports the invoice as paid. The settled amount may differ from the requested one.
 */
@Value
@Builder
@Jacksonized
public class InvoiceSettled implements PaymentEvent {

    public static final String EVENT_TYPE = "InvoiceSettled";

    Amount amountSettled;
    String transactionId;
    Instant settledAt;

    @Override
    @JsonIgnore
    public String getEventType() {
        return EVENT_TYPE;
    }
}
