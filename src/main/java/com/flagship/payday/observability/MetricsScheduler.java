package com.flagship.payday.observability;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically refreshes gauges that need a database query, so a scrape never does.
 */
@Component
@RequiredArgsConstructor
public class MetricsScheduler {

    private final ProjectionMetrics projectionMetrics;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshProjectionMetrics() {
        projectionMetrics.refreshMetrics();
    }
}
