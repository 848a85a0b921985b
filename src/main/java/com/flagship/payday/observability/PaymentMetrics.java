package com.flagship.payday.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for payment commands, node calls and reconciliation.
 *
 * Metrics exposed:
 * - payday.command.duration: Timer per command and outcome (applied, noop, rejected, conflict, node_error, error)
 * - payday.events.appended: Counter per event type
 * - payday.command.conflicts: Counter of optimistic concurrency conflicts (before retry)
 * - payday.anomalies: Counter of events the state machine ignored
 * - payday.node.duration: Timer per node operation and outcome
 * - payday.reconciliations: Counter per notification type and outcome
 * - payday.idempotency: Counter of API replays (hit) and first requests (miss)
 */
@Component
public class PaymentMetrics {

    private final MeterRegistry registry;

    private final Counter concurrencyConflicts;
    private final Counter idempotencyHits;
    private final Counter idempotencyMisses;

    public PaymentMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.concurrencyConflicts = Counter.builder("payday.command.conflicts")
                .description("Number of appends that lost an optimistic concurrency race")
                .register(registry);

        this.idempotencyHits = Counter.builder("payday.idempotency")
                .description("API requests answered from an existing aggregate")
                .tag("result", "hit")
                .register(registry);

        this.idempotencyMisses = Counter.builder("payday.idempotency")
                .description("API requests that created a new aggregate")
                .tag("result", "miss")
                .register(registry);
    }

    // ==================== Commands ====================

    public void recordCommand(String command, String outcome, long durationMs) {
        Timer.builder("payday.command.duration")
                .description("Time taken to handle a payment command")
                .tag("command", command)
                .tag("outcome", outcome)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordEventAppended(String eventType) {
        registry.counter("payday.events.appended", "event_type", eventType).increment();
    }

    public void recordConcurrencyConflict() {
        concurrencyConflicts.increment();
    }

    public void recordAnomaly(String eventType) {
        registry.counter("payday.anomalies", "event_type", eventType).increment();
    }

    // ==================== Node ====================

    public void recordNodeCall(String operation, String outcome, long durationMs) {
        Timer.builder("payday.node.duration")
                .description("Latency of node backend calls")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordReconciliation(String notificationType, String outcome) {
        registry.counter("payday.reconciliations",
                "notification_type", notificationType,
                "outcome", outcome
        ).increment();
    }

    // ==================== API ====================

    public void recordIdempotencyHit() {
        idempotencyHits.increment();
    }

    public void recordIdempotencyMiss() {
        idempotencyMisses.increment();
    }
}
