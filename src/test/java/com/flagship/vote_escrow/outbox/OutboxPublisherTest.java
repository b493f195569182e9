package com.flagship.vote_escrow.outbox;

import com.flagship.vote_escrow.config.JacksonConfig;
import com.flagship.vote_escrow.event.PositionTransferredEvent;
import com.flagship.vote_escrow.observability.OutboxMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Publisher behavior against a mocked Kafka template:
 * - successful sends remove events from the outbox
 * - failed sends increment the retry count
 * - events past max retries are left as dead letters
 * - events are keyed by position id
 */
class OutboxPublisherTest {

    private static final String TOPIC = "vote-escrow-locks-test";
    private static final UUID FROM = UUID.fromString("00000000-0000-0000-0000-0000000a11ce");
    private static final UUID TO = UUID.fromString("00000000-0000-0000-0000-000000000b0b");

    private OutboxService outboxService;
    private SimpleMeterRegistry meterRegistry;
    private KafkaTemplate<String, String> kafkaTemplate;
    private OutboxPublisher publisher;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        outboxService = new OutboxService(new JacksonConfig().objectMapper());
        meterRegistry = new SimpleMeterRegistry();
        kafkaTemplate = mock(KafkaTemplate.class);
        OutboxMetrics outboxMetrics = new OutboxMetrics(outboxService, meterRegistry);

        publisher = new OutboxPublisher(outboxService, kafkaTemplate, outboxMetrics);
        ReflectionTestUtils.setField(publisher, "locksTopic", TOPIC);
        ReflectionTestUtils.setField(publisher, "batchSize", 100);
        ReflectionTestUtils.setField(publisher, "maxRetries", 2);
    }

    private void enqueueTransfer(long positionId) {
        outboxService.enqueue(outboxService.prepareEvents(List.of(
            PositionTransferredEvent.of(positionId, FROM, TO, 604_800L))));
    }

    private static CompletableFuture<SendResult<String, String>> sent(String key, String payload) {
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 0), 0L, 0, 0L, 0, 0);
        return CompletableFuture.completedFuture(
            new SendResult<>(new ProducerRecord<>(TOPIC, key, payload), metadata));
    }

    @Test
    @DisplayName("Published events leave the outbox and are keyed by position id")
    void testPublishSuccess() {
        enqueueTransfer(42L);
        String payload = outboxService.findUnpublishedEvents(1).get(0).getPayload();
        when(kafkaTemplate.send(TOPIC, "42", payload)).thenReturn(sent("42", payload));

        publisher.publishPendingEvents();

        verify(kafkaTemplate).send(TOPIC, "42", payload);
        assertEquals(0, outboxService.countUnpublished());
        assertEquals(1.0, meterRegistry.get("outbox.events.published")
            .tag("status", "success").counter().count());
    }

    @Test
    @DisplayName("Failed sends stay in the outbox with an incremented retry count")
    void testPublishFailure() {
        enqueueTransfer(7L);
        when(kafkaTemplate.send(eq(TOPIC), anyString(), anyString()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.publishPendingEvents();

        OutboxEvent event = outboxService.findUnpublishedEvents(1).get(0);
        assertEquals(1, event.getRetryCount());
        assertTrue(event.getLastError().contains("broker down"));
        assertEquals(1.0, meterRegistry.get("outbox.events.published")
            .tag("status", "failure").counter().count());
    }

    @Test
    @DisplayName("Events past max retries are not sent again")
    void testDeadLetter() {
        enqueueTransfer(9L);
        when(kafkaTemplate.send(eq(TOPIC), anyString(), anyString()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.publishPendingEvents();
        publisher.publishPendingEvents();
        publisher.publishPendingEvents();

        verify(kafkaTemplate, times(2)).send(eq(TOPIC), anyString(), anyString());
        assertEquals(1, outboxService.countByRetryCountAtLeast(2));
        assertEquals(1.0, meterRegistry.get("outbox.events.dead_lettered").counter().count());
    }

    @Test
    @DisplayName("Events are sent in commit order")
    void testPublishOrder() {
        enqueueTransfer(1L);
        enqueueTransfer(2L);
        enqueueTransfer(3L);
        when(kafkaTemplate.send(eq(TOPIC), anyString(), anyString()))
            .thenAnswer(invocation -> sent(invocation.getArgument(1), invocation.getArgument(2)));

        publisher.publishPendingEvents();

        InOrder order = inOrder(kafkaTemplate);
        order.verify(kafkaTemplate).send(eq(TOPIC), eq("1"), anyString());
        order.verify(kafkaTemplate).send(eq(TOPIC), eq("2"), anyString());
        order.verify(kafkaTemplate).send(eq(TOPIC), eq("3"), anyString());
        assertEquals(0, outboxService.countUnpublished());
    }
}
