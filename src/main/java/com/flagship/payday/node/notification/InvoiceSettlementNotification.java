package com.flagship.payday.node.notification;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.payday.payment.Amount;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A Lightning invoice was paid. {@code settleIndex} increases with every settlement on the node.
 */
@Value
@Builder
@Jacksonized
public class InvoiceSettlementNotification implements NodeNotification {
    String paymentHash;
    Amount amountSettled;
    long settleIndex;
    Instant settledAt;

    @Override
    @JsonIgnore
    public String getReference() {
        return paymentHash;
    }
}
