package com.flagship.budget_ledger.outbox;

import com.flagship.budget_ledger.observability.OutboxMetrics;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Publisher behaviour with the outbox and Kafka mocked out.
 */
class OutboxPublisherTest {

    private static final String TOPIC = "budget-ledger-events";
    private static final int MAX_RETRIES = 5;

    private OutboxService outboxService;
    private KafkaTemplate<String, String> kafkaTemplate;
    private OutboxMetrics outboxMetrics;
    private OutboxPublisher publisher;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        outboxService = mock(OutboxService.class);
        kafkaTemplate = mock(KafkaTemplate.class);
        outboxMetrics = mock(OutboxMetrics.class);
        publisher = new OutboxPublisher(outboxService, kafkaTemplate, outboxMetrics);
        ReflectionTestUtils.setField(publisher, "topic", TOPIC);
        ReflectionTestUtils.setField(publisher, "batchSize", 10);
        ReflectionTestUtils.setField(publisher, "maxRetries", MAX_RETRIES);
        ReflectionTestUtils.setField(publisher, "sendTimeoutMs", 1000L);
    }

    private static OutboxEvent event(int retryCount) {
        return new OutboxEvent(UUID.randomUUID(), "Transfer", UUID.randomUUID(), "TransferPosted",
            "{\"amount\":12.00}", Instant.now(), null, retryCount, null, 1L);
    }

    @Test
    @DisplayName("Sent events are keyed by aggregate id, carry type headers and are marked published")
    @SuppressWarnings("unchecked")
    void testPublishesAndMarks() {
        OutboxEvent event = event(0);
        when(outboxService.lockNextBatch(anyInt(), anyInt())).thenReturn(List.of(event));
        when(kafkaTemplate.send(any(ProducerRecord.class))).thenAnswer(invocation -> {
            ProducerRecord<String, String> record = invocation.getArgument(0);
            RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 0), 42L, 0, 0L, 0, 0);
            return CompletableFuture.completedFuture(new SendResult<>(record, metadata));
        });

        publisher.publishPendingEvents();

        ArgumentCaptor<ProducerRecord<String, String>> sent = ArgumentCaptor.forClass(ProducerRecord.class);
        verify(kafkaTemplate).send(sent.capture());
        ProducerRecord<String, String> record = sent.getValue();
        assertEquals(TOPIC, record.topic());
        assertEquals(event.getAggregateId().toString(), record.key());
        assertEquals(event.getPayload(), record.value());
        assertEquals("TransferPosted", new String(
            record.headers().lastHeader(OutboxPublisher.EVENT_TYPE_HEADER).value(), StandardCharsets.UTF_8));

        verify(outboxService).markPublished(event.getId());
        verify(outboxMetrics).recordEventPublished("TransferPosted");
    }

    @Test
    @DisplayName("Failed send marks the event failed; the last allowed attempt dead-letters it")
    @SuppressWarnings("unchecked")
    void testFailureAndDeadLetter() {
        OutboxEvent firstAttempt = event(0);
        OutboxEvent lastAttempt = event(MAX_RETRIES - 1);
        when(outboxService.lockNextBatch(anyInt(), anyInt())).thenReturn(List.of(firstAttempt, lastAttempt));
        when(kafkaTemplate.send(any(ProducerRecord.class)))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.publishPendingEvents();

        verify(outboxService).markFailed(eq(firstAttempt.getId()), anyString());
        verify(outboxService).markFailed(eq(lastAttempt.getId()), anyString());
        verify(outboxService, never()).markPublished(any());
        verify(outboxMetrics).recordEventDeadLettered("TransferPosted");
    }

    @Test
    @DisplayName("An empty backlog sends nothing")
    @SuppressWarnings("unchecked")
    void testEmptyBacklog() {
        when(outboxService.lockNextBatch(anyInt(), anyInt())).thenReturn(List.of());

        publisher.publishPendingEvents();

        verify(kafkaTemplate, never()).send(any(ProducerRecord.class));
    }
}
