package com.flagship.payday.reconcile;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.payday.node.notification.NodeNotification;
import com.flagship.payday.observability.CorrelationContext;
import com.flagship.payday.payment.InvalidTransitionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Kafka consumer for node notifications relayed by node-side agents.
 *
 * Key design decisions:
 * - Manual acknowledgment (ack-mode=manual): the offset is only committed once the
 *   notification was reconciled
 * - Redelivered notifications are no-ops in the command handler, no dedupe table needed
 * - Unparseable messages and notifications that contradict the aggregate are acknowledged
 *   and logged, since redelivery cannot fix them
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class NodeNotificationConsumer {

    private final NodeReconciler reconciler;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.node-notifications:payday.node-notifications}",
        groupId = "${spring.kafka.consumer.group-id:payday-reconcilers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        CorrelationContext.begin(correlationIdOf(record));
        try {
            NodeNotification notification = parse(record.value());
            if (notification == null) {
                log.warn("Could not parse node notification, acknowledging to skip: {}", record.value());
                ack.acknowledge();
                return;
            }

            try {
                ReconcileOutcome outcome = reconciler.reconcile(notification);
                log.info("Reconciled {} for {}: {}", notification.getClass().getSimpleName(),
                        notification.getReference(), outcome);
            } catch (InvalidTransitionException e) {
                log.error("Node notification for {} contradicts payment {}, skipping: {}",
                        notification.getReference(), e.getAggregateId(), e.getMessage());
            }
            ack.acknowledge();

        } catch (RuntimeException e) {
            log.error("Error processing message at offset {}: {}", record.offset(), e.getMessage(), e);
            // Not acknowledged, the message is redelivered
            throw e;
        } finally {
            CorrelationContext.end();
        }
    }

    private NodeNotification parse(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, NodeNotification.class);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse node notification: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static String correlationIdOf(ConsumerRecord<String, String> record) {
        Header header = record.headers().lastHeader(CorrelationContext.CORRELATION_ID_HEADER);
        return header != null ? new String(header.value(), StandardCharsets.UTF_8) : null;
    }
}
