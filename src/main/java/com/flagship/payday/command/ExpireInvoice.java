package com.flagship.payday.command;

import lombok.Value;

import java.util.UUID;

@Value
public class ExpireInvoice implements PaymentCommand {
    UUID aggregateId;
}
