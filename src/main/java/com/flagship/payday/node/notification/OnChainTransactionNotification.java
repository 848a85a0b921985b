package com.flagship.payday.node.notification;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.payday.payment.Amount;
import com.flagship.payday.payment.PaymentDirection;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A wallet transaction was seen or gained confirmations. {@code blockHeight} is 0 while the
 * transaction is unconfirmed.
 *
 * Incoming transactions are matched by address, outgoing ones by transaction id.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class OnChainTransactionNotification implements NodeNotification {
    PaymentDirection direction;
    String address;
    String transactionId;
    Amount amount;
    int confirmations;
    long blockHeight;
    Instant observedAt;

    @Override
    @JsonIgnore
    public String getReference() {
        return direction == PaymentDirection.OUTGOING ? transactionId : address;
    }
}
