package com.flagship.payday.projection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.payday.config.JacksonConfig;
import com.flagship.payday.eventstore.EventMetadata;
import com.flagship.payday.eventstore.StoredEvent;
import com.flagship.payday.observability.CorrelationContext;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.header.Header;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for publishing stored events to Kafka.
 */
@ExtendWith(MockitoExtension.class)
class EventPublisherProjectionTest {

    private static final String TOPIC = "payday.events";

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Captor
    private ArgumentCaptor<ProducerRecord<String, String>> recordCaptor;

    private final ObjectMapper objectMapper = new JacksonConfig().objectMapper();
    private EventPublisherProjection publisher;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        publisher = new EventPublisherProjection(kafkaTemplate, objectMapper, TOPIC, 1_000);
    }

    private StoredEvent storedEvent(UUID aggregateId) {
        return StoredEvent.builder()
            .globalPosition(17)
            .aggregateType("Payment")
            .aggregateId(aggregateId)
            .sequence(2)
            .eventType("InvoiceSettled")
            .eventVersion("1")
            .payload("{\"amountSettled\":{\"currency\":\"BTC\",\"value\":5000}}")
            .metadata(EventMetadata.of("corr-42", EventMetadata.SOURCE_RECONCILER).withNodeId("sim-lightning"))
            .recordedAt(Instant.parse("2026-01-15T10:00:00Z"))
            .build();
    }

    private static ProducerRecord<String, String> anyRecord() {
        return ArgumentMatchers.any();
    }

    private static CompletableFuture<SendResult<String, String>> acked(ProducerRecord<String, String> record) {
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(record.topic(), 0), 0, 5, 0, 0, 0);
        return CompletableFuture.completedFuture(new SendResult<>(record, metadata));
    }

    @Test
    @DisplayName("Event is sent keyed by aggregate id with the full envelope")
    void publishesEnvelope() throws Exception {
        printTestHeader("Event is sent keyed by aggregate id with the full envelope");
        UUID aggregateId = UUID.randomUUID();
        when(kafkaTemplate.send(anyRecord()))
            .thenAnswer(invocation -> acked(invocation.getArgument(0)));

        publisher.handle(storedEvent(aggregateId));

        verify(kafkaTemplate).send(recordCaptor.capture());
        ProducerRecord<String, String> sent = recordCaptor.getValue();
        printOutput("Message", sent.value());

        assertEquals(TOPIC, sent.topic());
        assertEquals(aggregateId.toString(), sent.key());
        Header header = sent.headers().lastHeader(CorrelationContext.CORRELATION_ID_HEADER);
        assertEquals("corr-42", new String(header.value(), StandardCharsets.UTF_8));

        JsonNode envelope = objectMapper.readTree(sent.value());
        assertEquals(17, envelope.get("globalPosition").asLong());
        assertEquals(2, envelope.get("sequence").asLong());
        assertEquals("InvoiceSettled", envelope.get("eventType").asText());
        assertEquals("2026-01-15T10:00:00Z", envelope.get("recordedAt").asText());
        assertEquals("reconciler", envelope.get("metadata").get("source").asText());
        assertEquals("sim-lightning", envelope.get("metadata").get("nodeId").asText());
        assertEquals(5000, envelope.get("payload").get("amountSettled").get("value").asLong());

        printSuccess("Envelope published");
    }

    @Test
    @DisplayName("Broker failure surfaces so the runner does not advance")
    void brokerFailurePropagates() {
        when(kafkaTemplate.send(anyRecord()))
            .thenReturn(CompletableFuture.failedFuture(new RuntimeException("broker unavailable")));

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> publisher.handle(storedEvent(UUID.randomUUID())));

        assertTrue(e.getMessage().contains("17"));
    }

    @Test
    @DisplayName("Send that never completes times out")
    void sendTimesOut() {
        publisher = new EventPublisherProjection(kafkaTemplate, objectMapper, TOPIC, 10);
        when(kafkaTemplate.send(anyRecord())).thenReturn(new CompletableFuture<>());

        assertThrows(IllegalStateException.class, () -> publisher.handle(storedEvent(UUID.randomUUID())));
    }
}
