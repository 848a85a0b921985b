package com.flagship.payday.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Correlation id of the unit of work running on the current thread: an HTTP request, a
 * Kafka message, a node notification or one scheduled recovery. The id is recorded in the
 * metadata of every event appended during that unit and mirrored into the MDC for logging.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String AGGREGATE_ID_MDC_KEY = "aggregateId";

    private static final ThreadLocal<String> current = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Starts a unit of work. A null or blank id is replaced with a fresh one.
     *
     * @return the id now in effect
     */
    public static String begin(String correlationId) {
        String id = correlationId == null || correlationId.isBlank() ? newCorrelationId() : correlationId;
        current.set(id);
        MDC.put(CORRELATION_ID_MDC_KEY, id);
        return id;
    }

    /**
     * Ends the unit of work. Always call from a finally block; pooled threads are reused.
     */
    public static void end() {
        current.remove();
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(AGGREGATE_ID_MDC_KEY);
    }

    /**
     * Id of the current unit of work. Outside of one, a fresh id that is not bound to the thread.
     */
    public static String currentId() {
        String id = current.get();
        return id != null ? id : newCorrelationId();
    }

    public static boolean isActive() {
        return current.get() != null;
    }

    public static void tagAggregate(UUID aggregateId) {
        MDC.put(AGGREGATE_ID_MDC_KEY, aggregateId.toString());
    }

    public static void untagAggregate() {
        MDC.remove(AGGREGATE_ID_MDC_KEY);
    }

    // Eight hex chars keep log lines short
    private static String newCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
