package com.flagship.payday.payment.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.payday.payment.Amount;
import com.flagship.payday.payment.SettlementMethod;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * An invoice was issued by our node. First event of every incoming stream.
 *
 * For Lightning the node reference is the payment hash and the payment request is the BOLT11
 * string; on-chain both carry the receiving address.
 */
@Value
@Builder
@Jacksonized
public class InvoiceCreated implements PaymentEvent {

    public static final String EVENT_TYPE = "InvoiceCreated";

    SettlementMethod method;
    Amount amount;
    Instant expiresAt;
    String nodeId;
    String nodeReference;
    String paymentRequest;
    String memo;
    Instant createdAt;

    @Override
    @JsonIgnore
    public String getEventType() {
        return EVENT_TYPE;
    }
}
