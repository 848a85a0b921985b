package com.flagship.payday.command;

import com.flagship.payday.payment.Amount;
import lombok.Value;

import java.util.UUID;

/**
 * Record an unconfirmed on-chain payment to an invoice address.
 */
@Value
public class RecordPendingPayment implements PaymentCommand {
    UUID aggregateId;
    Amount amount;
    String transactionId;
    int confirmations;
}
