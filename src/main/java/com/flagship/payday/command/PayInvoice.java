package com.flagship.payday.command;

import com.flagship.payday.payment.Amount;
import com.flagship.payday.payment.SettlementMethod;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Send a payment. Lightning payments carry a payment request; on-chain payments a destination
 * address and an amount. {@code amount} is optional for Lightning requests that encode one.
 */
@Value
@Builder
public class PayInvoice implements PaymentCommand {
    UUID aggregateId;
    SettlementMethod method;
    String paymentRequest;
    String destination;
    Amount amount;
}
