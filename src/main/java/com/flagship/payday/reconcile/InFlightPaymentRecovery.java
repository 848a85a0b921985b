package com.flagship.payday.reconcile;

import com.flagship.payday.command.CommandRejectedException;
import com.flagship.payday.command.PaymentCommandHandler;
import com.flagship.payday.command.RecordPaymentOutcome;
import com.flagship.payday.eventstore.EventMetadata;
import com.flagship.payday.node.LightningNode;
import com.flagship.payday.node.NodeException;
import com.flagship.payday.node.PaymentAttempt;
import com.flagship.payday.node.PaymentAttemptStatus;
import com.flagship.payday.observability.CorrelationContext;
import com.flagship.payday.payment.FailureReason;
import com.flagship.payday.payment.InvalidTransitionException;
import com.flagship.payday.payment.PaymentDirection;
import com.flagship.payday.payment.PaymentStatus;
import com.flagship.payday.payment.SettlementMethod;
import com.flagship.payday.projection.PaymentSummaryEntity;
import com.flagship.payday.projection.PaymentSummaryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Resolves outgoing Lightning payments that stayed IN_FLIGHT, e.g. because the process died
 * between the node call and recording its result, by asking the node for their status.
 *
 * A node that has no record of the payment never sent it, so the payment is failed. On-chain
 * payments are left to the transaction subscription.
 */
@Component
@ConditionalOnProperty(name = "payday.recovery.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class InFlightPaymentRecovery {

    private final PaymentSummaryRepository summaries;
    private final LightningNode lightningNode;
    private final PaymentCommandHandler commandHandler;
    private final Clock clock;
    private final Duration minAge;

    public InFlightPaymentRecovery(PaymentSummaryRepository summaries,
                                   LightningNode lightningNode,
                                   PaymentCommandHandler commandHandler,
                                   Clock clock,
                                   @Value("${payday.recovery.min-age:PT1M}") Duration minAge) {
        this.summaries = summaries;
        this.lightningNode = lightningNode;
        this.commandHandler = commandHandler;
        this.clock = clock;
        this.minAge = minAge;
    }

    @Scheduled(fixedDelayString = "${payday.recovery.interval-ms:60000}")
    public void recoverInFlightPayments() {
        List<PaymentSummaryEntity> stuck = summaries.findByStatusAndMethodAndUpdatedAtBefore(
            PaymentStatus.IN_FLIGHT, SettlementMethod.LIGHTNING, clock.instant().minus(minAge));
        if (stuck.isEmpty()) {
            return;
        }

        log.info("Checking {} in-flight Lightning payments", stuck.size());
        int resolved = 0;
        for (PaymentSummaryEntity summary : stuck) {
            if (summary.getDirection() == PaymentDirection.OUTGOING && recover(summary)) {
                resolved++;
            }
        }
        log.info("Resolved {} of {} in-flight Lightning payments", resolved, stuck.size());
    }

    /**
     * @return true if an outcome was recorded
     */
    boolean recover(PaymentSummaryEntity summary) {
        CorrelationContext.begin(null);
        try {
            PaymentAttempt attempt = lightningNode.getPaymentStatus(summary.getNodeReference());
            if (attempt.getStatus() == PaymentAttemptStatus.IN_FLIGHT) {
                log.debug("Payment {} still in flight at the node", summary.getId());
                return false;
            }

            RecordPaymentOutcome.RecordPaymentOutcomeBuilder outcome = RecordPaymentOutcome.builder()
                .aggregateId(summary.getId())
                .nodeReference(summary.getNodeReference());
            if (attempt.getStatus() == PaymentAttemptStatus.UNKNOWN) {
                outcome.status(PaymentAttemptStatus.FAILED)
                    .failureReason(FailureReason.NODE_ERROR)
                    .message("Node has no record of the payment");
            } else {
                outcome.status(attempt.getStatus())
                    .amount(attempt.getAmount())
                    .fee(attempt.getFee())
                    .failureReason(attempt.getFailureReason())
                    .message(attempt.getMessage());
            }
            return !commandHandler.handle(outcome.build(), EventMetadata.SOURCE_SCHEDULER).isNoop();

        } catch (NodeException e) {
            log.warn("Status query for in-flight payment {} failed: {}", summary.getId(), e.getMessage());
            return false;
        } catch (CommandRejectedException | InvalidTransitionException e) {
            log.error("Could not record recovered outcome for payment {}: {}", summary.getId(), e.getMessage());
            return false;
        } finally {
            CorrelationContext.end();
        }
    }
}
