package com.flagship.payday.command;

import java.util.UUID;

/**
 * A request to change one payment aggregate.
 */
public interface PaymentCommand {

    UUID getAggregateId();
}
