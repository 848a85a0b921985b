package com.flagship.payday.payment.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * The node accepted the outgoing payment and it is still pending.
 * On-chain the node reference is the broadcast transaction id.
 */
@Value
@Builder
@Jacksonized
public class PaymentInFlight implements PaymentEvent {

    public static final String EVENT_TYPE = "PaymentInFlight";

    String nodeReference;
    Instant submittedAt;

    @Override
    @JsonIgnore
    public String getEventType() {
        return EVENT_TYPE;
    }
}
