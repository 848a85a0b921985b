package com.flagship.payday.projection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flagship.payday.eventstore.StoredEvent;
import com.flagship.payday.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes every stored event to Kafka.
 *
 * Key design decisions:
 * - Aggregate id as message key, so one payment's events stay ordered within a partition
 * - Sends synchronously; the runner only advances the offset after the broker acknowledged
 * - At-least-once: consumers deduplicate on (aggregateId, sequence)
 */
@Component
@ConditionalOnProperty(name = "payday.publisher.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class EventPublisherProjection implements Projection {

    public static final String NAME = "event-publisher";

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String eventsTopic;
    private final long sendTimeoutMs;

    public EventPublisherProjection(KafkaTemplate<String, String> kafkaTemplate,
                                    ObjectMapper objectMapper,
                                    @Value("${kafka.topic.events:payday.events}") String eventsTopic,
                                    @Value("${payday.publisher.send-timeout-ms:10000}") long sendTimeoutMs) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.eventsTopic = eventsTopic;
        this.sendTimeoutMs = sendTimeoutMs;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void handle(StoredEvent event) {
        ProducerRecord<String, String> record =
            new ProducerRecord<>(eventsTopic, event.getAggregateId().toString(), toJson(event));
        if (event.getMetadata() != null && event.getMetadata().getCorrelationId() != null) {
            record.headers().add(CorrelationContext.CORRELATION_ID_HEADER,
                event.getMetadata().getCorrelationId().getBytes(StandardCharsets.UTF_8));
        }

        try {
            SendResult<String, String> result = kafkaTemplate.send(record).get(sendTimeoutMs, TimeUnit.MILLISECONDS);
            log.debug("Published event: position={}, topic={}, partition={}, offset={}, eventType={}",
                event.getGlobalPosition(),
                result.getRecordMetadata().topic(),
                result.getRecordMetadata().partition(),
                result.getRecordMetadata().offset(),
                event.getEventType());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while publishing event " + event.getGlobalPosition(), e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IllegalStateException("Failed to publish event " + event.getGlobalPosition(), e);
        }
    }

    private String toJson(StoredEvent event) {
        try {
            ObjectNode envelope = objectMapper.createObjectNode();
            envelope.put("globalPosition", event.getGlobalPosition());
            envelope.put("aggregateType", event.getAggregateType());
            envelope.put("aggregateId", event.getAggregateId().toString());
            envelope.put("sequence", event.getSequence());
            envelope.put("eventType", event.getEventType());
            envelope.put("eventVersion", event.getEventVersion());
            envelope.put("recordedAt", event.getRecordedAt() != null ? event.getRecordedAt().toString() : null);
            envelope.set("metadata", objectMapper.valueToTree(event.getMetadata()));
            envelope.set("payload", objectMapper.readTree(event.getPayload()));
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize event " + event.getGlobalPosition(), e);
        }
    }
}
