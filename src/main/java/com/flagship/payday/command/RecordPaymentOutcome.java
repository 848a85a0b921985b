package com.flagship.payday.command;

import com.flagship.payday.node.PaymentAttemptStatus;
import com.flagship.payday.payment.Amount;
import com.flagship.payday.payment.FailureReason;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Record what the node reported about an outgoing payment.
 */
@Value
@Builder
public class RecordPaymentOutcome implements PaymentCommand {
    UUID aggregateId;
    PaymentAttemptStatus status;
    Amount amount;
    Amount fee;
    String nodeReference;
    String transactionId;
    FailureReason failureReason;
    String message;
}
