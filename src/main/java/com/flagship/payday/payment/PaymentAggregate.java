package com.flagship.payday.payment;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

/**
 * Current state of one invoice or outgoing payment, derived from its event stream.
 *
 * Instances are immutable; {@link PaymentReducer} produces a new one per applied event.
 * {@code version} is the sequence of the last event folded in, 0 for an empty stream.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PaymentAggregate {

    public static final String AGGREGATE_TYPE = "Payment";

    UUID id;
    PaymentDirection direction;
    SettlementMethod method;
    PaymentStatus status;
    Amount amountRequested;
    Amount amountSettled;
    Amount amountPending;
    Amount fee;
    boolean overpaid;
    String nodeId;
    String nodeReference;
    String paymentRequest;
    String destination;
    String transactionId;
    String memo;
    Instant expiresAt;
    Instant createdAt;
    Instant settledAt;
    FailureReason failureReason;
    String failureMessage;
    long version;

    /**
     * State of a stream with no events.
     */
    public static PaymentAggregate empty(UUID id) {
        return PaymentAggregate.builder()
            .id(id)
            .version(0)
            .build();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return version == 0;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    @JsonIgnore
    public boolean isIncoming() {
        return direction == PaymentDirection.INCOMING;
    }

    @JsonIgnore
    public boolean isOutgoing() {
        return direction == PaymentDirection.OUTGOING;
    }

    PaymentAggregate atVersion(long sequence) {
        return toBuilder().version(sequence).build();
    }
}
