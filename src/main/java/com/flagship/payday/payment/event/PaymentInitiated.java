package com.flagship.payday.payment.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.payday.payment.Amount;
import com.flagship.payday.payment.SettlementMethod;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * An outgoing payment was recorded. Written before the node is asked to pay, so a payment
 * request can never be paid twice from the same stream.
 */
@Value
@Builder
@Jacksonized
public class PaymentInitiated implements PaymentEvent {

    public static final String EVENT_TYPE = "PaymentInitiated";

    SettlementMethod method;
    Amount amount;
    String paymentRequest;
    String destination;
    String nodeId;
    String nodeReference;
    Instant initiatedAt;

    @Override
    @JsonIgnore
    public String getEventType() {
        return EVENT_TYPE;
    }
}
