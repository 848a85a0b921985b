package com.flagship.payday.node;

import com.flagship.payday.payment.Amount;
import lombok.Value;

import java.time.Instant;

/**
 * Invoice issued by a Lightning node.
 */
@Value
public class NodeInvoice {
    String paymentHash;
    String paymentRequest;
    Amount amount;
    Instant expiresAt;
}
