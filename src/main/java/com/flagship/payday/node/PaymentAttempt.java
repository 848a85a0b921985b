package com.flagship.payday.node;

import com.flagship.payday.payment.Amount;
import com.flagship.payday.payment.FailureReason;
import lombok.Builder;
import lombok.Value;

/**
 * Node-side view of an outgoing Lightning payment.
 */
@Value
@Builder(toBuilder = true)
public class PaymentAttempt {
    String paymentHash;
    PaymentAttemptStatus status;
    Amount amount;
    Amount fee;
    String preimage;
    FailureReason failureReason;
    String message;

    public static PaymentAttempt unknown(String paymentHash) {
        return PaymentAttempt.builder()
            .paymentHash(paymentHash)
            .status(PaymentAttemptStatus.UNKNOWN)
            .build();
    }
}
