package com.flagship.payday.payment.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.payday.payment.Amount;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * An on-chain payment to the invoice address was seen but is not yet confirmed.
 */
@Value
@Builder
@Jacksonized
public class InvoicePaymentDetected implements PaymentEvent {

    public static final String EVENT_TYPE = "InvoicePaymentDetected";

    Amount amount;
    String transactionId;
    int confirmations;
    Instant detectedAt;

    @Override
    @JsonIgnore
    public String getEventType() {
        return EVENT_TYPE;
    }
}
