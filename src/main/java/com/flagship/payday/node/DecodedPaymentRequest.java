package com.flagship.payday.node;

import com.flagship.payday.payment.Amount;
import lombok.Value;

import java.time.Instant;

/**
 * Fields of a payment request as decoded by the node. {@code amount} is null for
 * amountless requests.
 */
@Value
public class DecodedPaymentRequest {
    String paymentHash;
    Amount amount;
    String destination;
    String memo;
    Instant expiresAt;
}
