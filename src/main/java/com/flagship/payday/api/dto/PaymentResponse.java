package com.flagship.payday.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.payday.payment.Amount;
import com.flagship.payday.payment.FailureReason;
import com.flagship.payday.payment.PaymentAggregate;
import com.flagship.payday.payment.PaymentDirection;
import com.flagship.payday.payment.PaymentStatus;
import com.flagship.payday.payment.SettlementMethod;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Current state of an invoice or outgoing payment.
 */
@Value
@Builder
public class PaymentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("direction")
    PaymentDirection direction;

    @JsonProperty("method")
    SettlementMethod method;

    @JsonProperty("status")
    PaymentStatus status;

    @JsonProperty("amount_requested_sats")
    Long amountRequestedSats;

    @JsonProperty("amount_settled_sats")
    Long amountSettledSats;

    @JsonProperty("amount_pending_sats")
    Long amountPendingSats;

    @JsonProperty("fee_sats")
    Long feeSats;

    @JsonProperty("overpaid")
    boolean overpaid;

    @JsonProperty("payment_request")
    String paymentRequest;

    @JsonProperty("destination")
    String destination;

    @JsonProperty("node_reference")
    String nodeReference;

    @JsonProperty("transaction_id")
    String transactionId;

    @JsonProperty("memo")
    String memo;

    @JsonProperty("expires_at")
    Instant expiresAt;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("settled_at")
    Instant settledAt;

    @JsonProperty("failure_reason")
    FailureReason failureReason;

    @JsonProperty("failure_message")
    String failureMessage;

    @JsonProperty("version")
    long version;

    public static PaymentResponse from(PaymentAggregate payment) {
        return PaymentResponse.builder()
            .id(payment.getId())
            .direction(payment.getDirection())
            .method(payment.getMethod())
            .status(payment.getStatus())
            .amountRequestedSats(sats(payment.getAmountRequested()))
            .amountSettledSats(sats(payment.getAmountSettled()))
            .amountPendingSats(sats(payment.getAmountPending()))
            .feeSats(sats(payment.getFee()))
            .overpaid(payment.isOverpaid())
            .paymentRequest(payment.getPaymentRequest())
            .destination(payment.getDestination())
            .nodeReference(payment.getNodeReference())
            .transactionId(payment.getTransactionId())
            .memo(payment.getMemo())
            .expiresAt(payment.getExpiresAt())
            .createdAt(payment.getCreatedAt())
            .settledAt(payment.getSettledAt())
            .failureReason(payment.getFailureReason())
            .failureMessage(payment.getFailureMessage())
            .version(payment.getVersion())
            .build();
    }

    private static Long sats(Amount amount) {
        return amount != null ? amount.value() : null;
    }
}
