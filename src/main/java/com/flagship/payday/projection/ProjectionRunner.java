package com.flagship.payday.projection;

import com.flagship.payday.eventstore.EventStore;
import com.flagship.payday.eventstore.StoredEvent;
import com.flagship.payday.observability.ProjectionMetrics;
import com.flagship.payday.offset.OffsetStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.stream.Stream;

/**
 * Feeds every {@link Projection} from the event log, in global position order, and saves each
 * projection's offset after every handled event.
 *
 * A failing projection stops at the failing event without advancing; the next poll retries it.
 *
 * Global positions come from a database sequence, so a position can be missing for a while
 * (taken by a transaction that has not committed yet) or for good (rolled back). The runner
 * stops in front of a hole and only skips it once it has stayed open for the gap timeout.
 * A skipped hole is read once more after another gap timeout, and any event that committed
 * late is handed to the projection out of order. An event committing after that second look
 * is never seen by the projection.
 */
@Component
@ConditionalOnProperty(name = "payday.projection.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class ProjectionRunner {

    private final List<Projection> projections;
    private final EventStore eventStore;
    private final OffsetStore offsetStore;
    private final ProjectionMetrics projectionMetrics;
    private final Clock clock;
    private final int batchSize;
    private final Duration gapTimeout;
    private final Map<String, Gap> openGaps = new ConcurrentHashMap<>();
    private final Map<String, Queue<SkippedRange>> skippedRanges = new ConcurrentHashMap<>();

    public ProjectionRunner(List<Projection> projections,
                            EventStore eventStore,
                            OffsetStore offsetStore,
                            ProjectionMetrics projectionMetrics,
                            Clock clock,
                            @Value("${payday.projection.batch-size:100}") int batchSize,
                            @Value("${payday.projection.gap-timeout:2s}") Duration gapTimeout) {
        this.projections = projections;
        this.eventStore = eventStore;
        this.offsetStore = offsetStore;
        this.projectionMetrics = projectionMetrics;
        this.clock = clock;
        this.batchSize = batchSize;
        this.gapTimeout = gapTimeout;
        projections.forEach(projection -> projectionMetrics.register(projection.name()));
    }

    @Scheduled(fixedDelayString = "${payday.projection.poll-interval-ms:500}")
    public void poll() {
        for (Projection projection : projections) {
            try {
                runOnce(projection);
            } catch (Exception e) {
                log.error("Projection {} poll failed: {}", projection.name(), e.getMessage(), e);
            }
        }
    }

    /**
     * Handles at most one batch for the projection.
     *
     * @return number of events handled
     */
    public int runOnce(Projection projection) {
        String name = projection.name();
        long offset = offsetStore.get(name);
        int handled = recheckSkipped(projection);

        try (Stream<StoredEvent> batch = eventStore.loadAllSince(offset, batchSize)) {
            Iterator<StoredEvent> events = batch.iterator();
            while (events.hasNext()) {
                StoredEvent event = events.next();
                if (event.getGlobalPosition() != offset + 1 && !gapExpired(name, offset, event.getGlobalPosition())) {
                    break;
                }

                try {
                    projection.handle(event);
                } catch (RuntimeException e) {
                    projectionMetrics.recordFailure(name);
                    log.error("Projection {} failed at position {} ({} {}#{}): {}", name, event.getGlobalPosition(),
                        event.getEventType(), event.getAggregateId(), event.getSequence(), e.getMessage());
                    break;
                }

                offset = event.getGlobalPosition();
                offsetStore.save(name, offset);
                openGaps.remove(name);
                handled++;
            }
        }

        if (handled > 0) {
            projectionMetrics.recordHandled(name, handled);
            log.debug("Projection {} handled {} events, now at position {}", name, handled, offset);
        }
        return handled;
    }

    private boolean gapExpired(String name, long offset, long nextPosition) {
        Instant now = clock.instant();
        Gap gap = openGaps.get(name);
        if (gap == null || gap.afterPosition() != offset) {
            gap = new Gap(offset, now);
            openGaps.put(name, gap);
        }
        if (Duration.between(gap.firstSeen(), now).compareTo(gapTimeout) < 0) {
            log.debug("Projection {} waiting on positions {}..{}", name, offset + 1, nextPosition - 1);
            return false;
        }

        log.warn("Projection {} skipping missing positions {}..{} after {}", name, offset + 1, nextPosition - 1, gapTimeout);
        projectionMetrics.recordGapSkipped(name);
        openGaps.remove(name);
        skippedRanges.computeIfAbsent(name, key -> new ConcurrentLinkedQueue<>())
            .add(new SkippedRange(offset + 1, nextPosition - 1, now));
        return true;
    }

    /**
     * Reads each skipped range once, a gap timeout after it was skipped. The offset is already
     * past these positions, so late events are handled without moving it.
     */
    private int recheckSkipped(Projection projection) {
        String name = projection.name();
        Queue<SkippedRange> ranges = skippedRanges.get(name);
        if (ranges == null) {
            return 0;
        }

        Instant now = clock.instant();
        int handled = 0;
        Iterator<SkippedRange> pending = ranges.iterator();
        while (pending.hasNext()) {
            SkippedRange range = pending.next();
            if (Duration.between(range.skippedAt(), now).compareTo(gapTimeout) < 0) {
                continue;
            }

            int limit = (int) Math.min(range.to() - range.from() + 1, batchSize);
            try (Stream<StoredEvent> late = eventStore.loadAllSince(range.from() - 1, limit)) {
                for (StoredEvent event : (Iterable<StoredEvent>) late::iterator) {
                    if (event.getGlobalPosition() > range.to()) {
                        break;
                    }
                    try {
                        projection.handle(event);
                    } catch (RuntimeException e) {
                        projectionMetrics.recordFailure(name);
                        log.error("Projection {} failed on late event at position {}: {}", name,
                            event.getGlobalPosition(), e.getMessage());
                        return handled;
                    }
                    log.warn("Projection {} handled late event at position {} ({} {}#{})", name,
                        event.getGlobalPosition(), event.getEventType(), event.getAggregateId(), event.getSequence());
                    projectionMetrics.recordLateEvent(name);
                    handled++;
                }
            }
            pending.remove();
        }
        return handled;
    }

    private record Gap(long afterPosition, Instant firstSeen) {}

    private record SkippedRange(long from, long to, Instant skippedAt) {}
}
