package com.flagship.payday.command;

import com.flagship.payday.payment.Amount;
import lombok.Value;

import java.util.UUID;

/**
 * Record that the node saw the invoice paid. {@code transactionId} is set for on-chain settlements.
 */
@Value
public class SettleInvoice implements PaymentCommand {
    UUID aggregateId;
    Amount amount;
    String transactionId;
}
