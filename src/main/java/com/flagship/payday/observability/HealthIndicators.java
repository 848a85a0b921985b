package com.flagship.payday.observability;

import com.flagship.payday.reconcile.NodeSubscriber;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;

/**
 * Actuator health contributors for payday.
 *
 * Only the projections can take the service down: Redis is a cache, node subscriptions
 * reconnect on their own and Kafka carries a redundant notification channel.
 */
public class HealthIndicators {

    static final Status DEGRADED = new Status("DEGRADED");

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /**
     * Read models behind the log. WARNING past 1000 unhandled events, DOWN past 10000.
     */
    @Component("projectionHealth")
    public static class ProjectionHealthIndicator implements HealthIndicator {

        static final long LAG_WARNING_THRESHOLD = 1_000;
        static final long LAG_CRITICAL_THRESHOLD = 10_000;

        private final ProjectionMetrics projectionMetrics;

        public ProjectionHealthIndicator(ProjectionMetrics projectionMetrics) {
            this.projectionMetrics = projectionMetrics;
        }

        @Override
        public Health health() {
            Map<String, Long> lags = new TreeMap<>(projectionMetrics.getLags());
            long worst = lags.values().stream().mapToLong(Long::longValue).max().orElse(0);

            Health.Builder builder;
            if (worst >= LAG_CRITICAL_THRESHOLD) {
                builder = Health.down();
            } else if (worst >= LAG_WARNING_THRESHOLD) {
                builder = Health.status("WARNING");
            } else {
                builder = Health.up();
            }
            return builder
                    .withDetail("lags", lags)
                    .withDetail("maxLag", worst)
                    .build();
        }
    }

    /**
     * Open node subscriptions. A dropped one is DEGRADED until the next resubscribe check.
     */
    @Component("nodeSubscriptionHealth")
    public static class NodeSubscriptionHealthIndicator implements HealthIndicator {

        private final ObjectProvider<NodeSubscriber<?>> subscribers;

        public NodeSubscriptionHealthIndicator(ObjectProvider<NodeSubscriber<?>> subscribers) {
            this.subscribers = subscribers;
        }

        @Override
        public Health health() {
            Map<String, String> states = new TreeMap<>();
            subscribers.orderedStream().forEach(subscriber ->
                    states.put(subscriber.getClass().getSimpleName(),
                            subscriber.isSubscribed() ? "SUBSCRIBED" : "RECONNECTING"));

            boolean allOpen = !states.containsValue("RECONNECTING");
            return (allOpen ? Health.up() : Health.status(DEGRADED))
                    .withDetails(Map.of("subscriptions", states))
                    .build();
        }
    }

    /**
     * Redis holds the node reference cache only; lookups fall back to PostgreSQL.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            RedisConnectionFactory factory = redisTemplate.getConnectionFactory();
            if (factory == null) {
                return Health.status(DEGRADED).withDetail("error", "No connection factory").build();
            }
            try (var connection = factory.getConnection()) {
                String pong = connection.ping();
                return ("PONG".equals(pong) ? Health.up() : Health.status(DEGRADED))
                        .withDetail("response", String.valueOf(pong))
                        .build();
            } catch (Exception e) {
                return Health.status(DEGRADED)
                        .withDetail("error", describe(e))
                        .withDetail("fallback", "database")
                        .build();
            }
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                int producerMetrics = kafkaTemplate.metrics().size();
                return (producerMetrics > 0 ? Health.up() : Health.status(DEGRADED))
                        .withDetail("producerMetrics", producerMetrics)
                        .build();
            } catch (Exception e) {
                return Health.status(DEGRADED).withDetail("error", describe(e)).build();
            }
        }
    }
}
