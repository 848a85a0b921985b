package com.flagship.payday.command;

import com.flagship.payday.payment.Amount;
import com.flagship.payday.payment.SettlementMethod;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.UUID;

@Value
@Builder
public class CreateInvoice implements PaymentCommand {
    UUID aggregateId;
    SettlementMethod method;
    Amount amount;
    Duration expiry;
    String memo;
}
