package com.flagship.payday.node.notification;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.payday.node.PaymentAttemptStatus;
import com.flagship.payday.payment.Amount;
import com.flagship.payday.payment.FailureReason;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Status change of an outgoing Lightning payment.
 */
@Value
@Builder
@Jacksonized
public class PaymentStatusNotification implements NodeNotification {
    String paymentHash;
    PaymentAttemptStatus status;
    Amount amount;
    Amount fee;
    FailureReason failureReason;
    String message;
    Instant reportedAt;

    @Override
    @JsonIgnore
    public String getReference() {
        return paymentHash;
    }
}
