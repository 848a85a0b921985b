package com.flagship.payday.projection;

import com.flagship.payday.payment.Amount;
import com.flagship.payday.payment.FailureReason;
import com.flagship.payday.payment.PaymentAggregate;
import com.flagship.payday.payment.PaymentDirection;
import com.flagship.payday.payment.PaymentStatus;
import com.flagship.payday.payment.SettlementMethod;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Read model row for one payment. Derived from the event log and rebuilt from it at will.
 *
 * Key design principles:
 * - No setters: rows only change through {@link #updateFrom(PaymentAggregate)}
 * - last_sequence guards against applying an older state over a newer one
 */
@Entity
@Table(
    name = "payment_summaries",
    indexes = {
        @Index(name = "idx_payment_summaries_status", columnList = "status"),
        @Index(name = "idx_payment_summaries_node_reference", columnList = "node_reference")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PaymentSummaryEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private PaymentDirection direction;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private SettlementMethod method;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PaymentStatus status;

    @Column(name = "amount_requested_sats", nullable = false)
    private long amountRequestedSats;

    @Column(name = "amount_settled_sats", nullable = false)
    private long amountSettledSats;

    @Column(name = "amount_pending_sats", nullable = false)
    private long amountPendingSats;

    @Column(name = "fee_sats")
    private Long feeSats;

    @Column(nullable = false)
    private boolean overpaid;

    @Column(name = "node_id")
    private String nodeId;

    @Column(name = "node_reference")
    private String nodeReference;

    @Column(name = "transaction_id")
    private String transactionId;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "settled_at")
    private Instant settledAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_reason")
    private FailureReason failureReason;

    @Column(name = "failure_message")
    private String failureMessage;

    @Column(name = "last_sequence", nullable = false)
    private long lastSequence;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    void onWrite() {
        this.updatedAt = Instant.now();
    }

    static PaymentSummaryEntity fromAggregate(PaymentAggregate aggregate) {
        PaymentSummaryEntity entity = new PaymentSummaryEntity();
        entity.id = aggregate.getId();
        entity.direction = aggregate.getDirection();
        entity.method = aggregate.getMethod();
        entity.updateFrom(aggregate);
        return entity;
    }

    /**
     * Copies the mutable fields of a newer aggregate state.
     *
     * @return false if {@code aggregate} is not newer than this row
     */
    boolean updateFrom(PaymentAggregate aggregate) {
        if (aggregate.getVersion() <= lastSequence) {
            return false;
        }
        this.status = aggregate.getStatus();
        this.amountRequestedSats = sats(aggregate.getAmountRequested());
        this.amountSettledSats = sats(aggregate.getAmountSettled());
        this.amountPendingSats = sats(aggregate.getAmountPending());
        this.feeSats = aggregate.getFee() != null ? aggregate.getFee().value() : null;
        this.overpaid = aggregate.isOverpaid();
        this.nodeId = aggregate.getNodeId();
        this.nodeReference = aggregate.getNodeReference();
        this.transactionId = aggregate.getTransactionId();
        this.expiresAt = aggregate.getExpiresAt();
        this.createdAt = aggregate.getCreatedAt();
        this.settledAt = aggregate.getSettledAt();
        this.failureReason = aggregate.getFailureReason();
        this.failureMessage = aggregate.getFailureMessage();
        this.lastSequence = aggregate.getVersion();
        return true;
    }

    private static long sats(Amount amount) {
        return amount != null ? amount.value() : 0L;
    }
}
