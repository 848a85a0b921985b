package com.flagship.payday.command;

import lombok.Value;

import java.util.UUID;

@Value
public class CancelInvoice implements PaymentCommand {
    UUID aggregateId;
    String reason;
}
