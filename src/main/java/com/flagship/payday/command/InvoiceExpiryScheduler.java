package com.flagship.payday.command;

import com.flagship.payday.eventstore.EventMetadata;
import com.flagship.payday.observability.CorrelationContext;
import com.flagship.payday.payment.InvalidTransitionException;
import com.flagship.payday.payment.PaymentStatus;
import com.flagship.payday.projection.PaymentSummaryEntity;
import com.flagship.payday.projection.PaymentSummaryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Expires invoices that are still awaiting payment after their expiry.
 *
 * Candidates come from the summary read model; the command handler re-checks against the
 * event stream, so a stale summary at worst produces a no-op.
 */
@Component
@ConditionalOnProperty(name = "payday.expiry.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class InvoiceExpiryScheduler {

    private final PaymentSummaryRepository summaries;
    private final PaymentCommandHandler commandHandler;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${payday.expiry.interval-ms:30000}")
    public void expireInvoices() {
        List<PaymentSummaryEntity> due = summaries.findByStatusAndExpiresAtBefore(
            PaymentStatus.AWAITING_PAYMENT, clock.instant());
        int expired = 0;
        for (PaymentSummaryEntity summary : due) {
            CorrelationContext.begin(null);
            try {
                CommandResult result = commandHandler.handle(new ExpireInvoice(summary.getId()),
                    EventMetadata.SOURCE_SCHEDULER);
                if (!result.isNoop()) {
                    expired++;
                }
            } catch (CommandRejectedException e) {
                log.warn("Could not expire invoice {}: {}", summary.getId(), e.getMessage());
            } catch (CommandConflictException e) {
                log.info("Invoice {} changed concurrently, retrying next run", summary.getId());
            } catch (InvalidTransitionException e) {
                log.error("Invoice {} cannot expire: {}", summary.getId(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Failed to expire invoice {}, retrying next run: {}", summary.getId(), e.getMessage(), e);
            } finally {
                CorrelationContext.end();
            }
        }
        if (expired > 0) {
            log.info("Expired {} of {} due invoices", expired, due.size());
        }
    }
}
