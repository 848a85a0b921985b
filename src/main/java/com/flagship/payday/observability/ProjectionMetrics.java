package com.flagship.payday.observability;

import com.flagship.payday.eventstore.EventStore;
import com.flagship.payday.offset.OffsetStore;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the projections tailing the event log.
 *
 * - projection.lag: events between the head of the log and the projection's offset
 * - projection.events.handled / projection.failures / projection.gaps.skipped: counters per projection
 * - projection.events.late: events picked up from a skipped gap on its second read
 *
 * Lag values are cached and refreshed by {@link MetricsScheduler} so scrapes never hit the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProjectionMetrics {

    private final EventStore eventStore;
    private final OffsetStore offsetStore;
    private final MeterRegistry meterRegistry;

    private final Map<String, AtomicLong> lags = new ConcurrentHashMap<>();

    public void register(String projection) {
        lags.computeIfAbsent(projection, name -> {
            AtomicLong lag = new AtomicLong(0);
            Gauge.builder("projection.lag", lag, AtomicLong::get)
                    .description("Events not yet handled by the projection")
                    .tag("projection", name)
                    .register(meterRegistry);
            return lag;
        });
    }

    public void refreshMetrics() {
        try {
            long head = eventStore.lastGlobalPosition();
            lags.forEach((projection, lag) -> lag.set(Math.max(0, head - offsetStore.get(projection))));
            log.debug("Projection metrics refreshed: head={}, lags={}", head, lags);
        } catch (Exception e) {
            log.warn("Failed to refresh projection metrics: {}", e.getMessage());
        }
    }

    /**
     * Last refreshed lag per projection.
     */
    public Map<String, Long> getLags() {
        Map<String, Long> snapshot = new ConcurrentHashMap<>();
        lags.forEach((projection, lag) -> snapshot.put(projection, lag.get()));
        return snapshot;
    }

    public void recordHandled(String projection, int count) {
        meterRegistry.counter("projection.events.handled", "projection", projection).increment(count);
    }

    public void recordFailure(String projection) {
        meterRegistry.counter("projection.failures", "projection", projection).increment();
    }

    public void recordGapSkipped(String projection) {
        meterRegistry.counter("projection.gaps.skipped", "projection", projection).increment();
    }

    public void recordLateEvent(String projection) {
        meterRegistry.counter("projection.events.late", "projection", projection).increment();
    }
}
