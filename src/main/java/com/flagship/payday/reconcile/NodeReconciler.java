package com.flagship.payday.reconcile;

import com.flagship.payday.command.CommandRejectedException;
import com.flagship.payday.command.CommandResult;
import com.flagship.payday.command.PaymentCommand;
import com.flagship.payday.command.PaymentCommandHandler;
import com.flagship.payday.command.PaymentNotFoundException;
import com.flagship.payday.command.RecordPaymentOutcome;
import com.flagship.payday.command.RecordPendingPayment;
import com.flagship.payday.command.SettleInvoice;
import com.flagship.payday.eventstore.EventMetadata;
import com.flagship.payday.node.PaymentAttemptStatus;
import com.flagship.payday.node.notification.InvoiceSettlementNotification;
import com.flagship.payday.node.notification.NodeNotification;
import com.flagship.payday.node.notification.OnChainTransactionNotification;
import com.flagship.payday.node.notification.PaymentStatusNotification;
import com.flagship.payday.observability.PaymentMetrics;
import com.flagship.payday.payment.PaymentDirection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Turns node notifications into commands against the aggregate that owns the node reference.
 *
 * Notifications arrive at least once and in any order; duplicates end up as no-ops in the
 * command handler. Notifications for references nobody registered are logged as unexpected
 * payments and dropped.
 */
@Service
@Slf4j
public class NodeReconciler {

    private final PaymentReferenceService references;
    private final PaymentCommandHandler commandHandler;
    private final PaymentMetrics paymentMetrics;
    private final int minConfirmations;

    public NodeReconciler(PaymentReferenceService references,
                          PaymentCommandHandler commandHandler,
                          PaymentMetrics paymentMetrics,
                          @Value("${payday.on-chain.min-confirmations:1}") int minConfirmations) {
        this.references = references;
        this.commandHandler = commandHandler;
        this.paymentMetrics = paymentMetrics;
        this.minConfirmations = minConfirmations;
    }

    /**
     * @throws com.flagship.payday.payment.InvalidTransitionException if the notification
     *         contradicts what the aggregate already recorded
     */
    public ReconcileOutcome reconcile(NodeNotification notification) {
        String notificationType = notification.getClass().getSimpleName();
        try {
            ReconcileOutcome outcome;
            if (notification instanceof InvoiceSettlementNotification settlement) {
                outcome = reconcileSettlement(settlement);
            } else if (notification instanceof PaymentStatusNotification status) {
                outcome = reconcilePaymentStatus(status);
            } else if (notification instanceof OnChainTransactionNotification transaction) {
                outcome = reconcileOnChain(transaction);
            } else {
                throw new IllegalArgumentException("Unsupported notification " + notificationType);
            }
            paymentMetrics.recordReconciliation(notificationType, outcome.name().toLowerCase());
            return outcome;
        } catch (RuntimeException e) {
            paymentMetrics.recordReconciliation(notificationType, "error");
            throw e;
        }
    }

    private ReconcileOutcome reconcileSettlement(InvoiceSettlementNotification notification) {
        Optional<UUID> owner = references.findOwner(notification.getPaymentHash());
        if (owner.isEmpty()) {
            return unmatched(notification);
        }
        return execute(new SettleInvoice(owner.get(), notification.getAmountSettled(), null));
    }

    private ReconcileOutcome reconcilePaymentStatus(PaymentStatusNotification notification) {
        if (notification.getStatus() == PaymentAttemptStatus.UNKNOWN) {
            return ReconcileOutcome.NOOP;
        }
        Optional<UUID> owner = references.findOwner(notification.getPaymentHash());
        if (owner.isEmpty()) {
            return unmatched(notification);
        }
        return execute(RecordPaymentOutcome.builder()
            .aggregateId(owner.get())
            .status(notification.getStatus())
            .amount(notification.getAmount())
            .fee(notification.getFee())
            .nodeReference(notification.getPaymentHash())
            .failureReason(notification.getFailureReason())
            .message(notification.getMessage())
            .build());
    }

    private ReconcileOutcome reconcileOnChain(OnChainTransactionNotification notification) {
        boolean confirmed = notification.getConfirmations() >= minConfirmations;

        if (notification.getDirection() == PaymentDirection.OUTGOING) {
            if (!confirmed) {
                log.debug("Outgoing transaction {} has {} confirmations, waiting", notification.getTransactionId(),
                    notification.getConfirmations());
                return ReconcileOutcome.NOOP;
            }
            Optional<UUID> owner = references.findOwner(notification.getTransactionId());
            if (owner.isEmpty()) {
                return unmatched(notification);
            }
            return execute(RecordPaymentOutcome.builder()
                .aggregateId(owner.get())
                .status(PaymentAttemptStatus.SUCCEEDED)
                .amount(notification.getAmount())
                .nodeReference(notification.getTransactionId())
                .transactionId(notification.getTransactionId())
                .build());
        }

        Optional<UUID> owner = references.findOwner(notification.getAddress());
        if (owner.isEmpty()) {
            return unmatched(notification);
        }
        if (!confirmed) {
            return execute(new RecordPendingPayment(owner.get(), notification.getAmount(),
                notification.getTransactionId(), notification.getConfirmations()));
        }
        return execute(new SettleInvoice(owner.get(), notification.getAmount(), notification.getTransactionId()));
    }

    private ReconcileOutcome execute(PaymentCommand command) {
        try {
            CommandResult result = commandHandler.handle(command, EventMetadata.SOURCE_RECONCILER);
            return result.isNoop() ? ReconcileOutcome.NOOP : ReconcileOutcome.APPLIED;
        } catch (PaymentNotFoundException e) {
            // Reference registered but the first event never made it (crash or lost race)
            log.warn("Node reference points to payment {} which has no events, skipping", e.getAggregateId());
            return ReconcileOutcome.UNMATCHED;
        } catch (CommandRejectedException e) {
            log.warn("Payment {} rejected node notification: {}", command.getAggregateId(), e.getMessage());
            return ReconcileOutcome.REJECTED;
        }
    }

    private ReconcileOutcome unmatched(NodeNotification notification) {
        log.warn("Unexpected payment: no aggregate owns node reference {} ({})", notification.getReference(),
            notification.getClass().getSimpleName());
        return ReconcileOutcome.UNMATCHED;
    }
}
