package com.flagship.payday.projection;

import com.flagship.payday.eventstore.StoredEvent;
import com.flagship.payday.payment.PaymentAggregate;
import com.flagship.payday.payment.PaymentAggregateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Keeps {@code payment_summaries} in step with the log. Each event triggers an upsert from the
 * aggregate's current state; rows already at or past the event's sequence are left alone.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PaymentSummaryProjection implements Projection {

    public static final String NAME = "payment-summary";

    private final PaymentSummaryRepository summaryRepository;
    private final PaymentAggregateRepository aggregateRepository;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    @Transactional
    public void handle(StoredEvent event) {
        if (!PaymentAggregate.AGGREGATE_TYPE.equals(event.getAggregateType())) {
            return;
        }

        Optional<PaymentSummaryEntity> existing = summaryRepository.findById(event.getAggregateId());
        if (existing.isPresent() && existing.get().getLastSequence() >= event.getSequence()) {
            log.debug("Summary of payment {} already at sequence {}, skipping event {}",
                event.getAggregateId(), existing.get().getLastSequence(), event.getSequence());
            return;
        }

        PaymentAggregate state = aggregateRepository.load(event.getAggregateId());
        if (existing.isPresent()) {
            existing.get().updateFrom(state);
            summaryRepository.save(existing.get());
        } else {
            summaryRepository.save(PaymentSummaryEntity.fromAggregate(state));
        }
        log.debug("Summary of payment {} updated to version {}: status={}", state.getId(),
            state.getVersion(), state.getStatus());
    }
}
