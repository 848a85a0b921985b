package com.flagship.payday.node.notification;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Something a node reported asynchronously. Delivered at least once, possibly out of order.
 *
 * The JSON form carries a {@code type} discriminator so notifications can travel over Kafka.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = InvoiceSettlementNotification.class, name = "invoice_settlement"),
    @JsonSubTypes.Type(value = PaymentStatusNotification.class, name = "payment_status"),
    @JsonSubTypes.Type(value = OnChainTransactionNotification.class, name = "onchain_transaction")
})
public interface NodeNotification {

    /**
     * The node-side reference used to find the owning aggregate.
     */
    @JsonIgnore
    String getReference();
}
