package com.inboxai.credit_core.outbox;

import com.inboxai.credit_core.observability.OutboxMetrics;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OutboxPublisherTest {

    private static final Instant NOW = Instant.parse("2026-06-10T12:00:00Z");

    @Mock
    private OutboxService outboxService;

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Mock
    private OutboxMetrics outboxMetrics;

    private OutboxPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new OutboxPublisher(outboxService, kafkaTemplate, outboxMetrics);
        ReflectionTestUtils.setField(publisher, "creditsTopic", "credit-events");
        ReflectionTestUtils.setField(publisher, "schedulesTopic", "schedule-events");
        ReflectionTestUtils.setField(publisher, "outboundMessagesTopic", "outbound-messages");
        ReflectionTestUtils.setField(publisher, "batchSize", 100);
        ReflectionTestUtils.setField(publisher, "maxRetries", 3);
        ReflectionTestUtils.setField(publisher, "sendTimeoutMs", 1000L);
    }

    @Test
    @DisplayName("Each aggregate type is routed to its own topic")
    void routesByAggregateType() {
        assertEquals("credit-events", publisher.topicFor(event(AggregateType.CREDIT_BALANCE)));
        assertEquals("schedule-events", publisher.topicFor(event(AggregateType.SCHEDULE_ENTRY)));
        assertEquals("outbound-messages", publisher.topicFor(event(AggregateType.OUTBOUND_MESSAGE)));
    }

    @Test
    @DisplayName("Published events are keyed by aggregate id and marked published")
    void publishesAndMarks() {
        OutboxEvent event = event(AggregateType.OUTBOUND_MESSAGE);
        String key = event.getAggregateId().toString();
        SendResult<String, String> sent = new SendResult<>(
            new ProducerRecord<>("outbound-messages", key, event.getPayload()),
            new RecordMetadata(new TopicPartition("outbound-messages", 0), 0L, 0, 0L, 0, 0));
        when(outboxService.findPublishableEvents(3, 100)).thenReturn(List.of(event));
        when(kafkaTemplate.send("outbound-messages", key, event.getPayload()))
            .thenReturn(CompletableFuture.completedFuture(sent));

        publisher.publishPendingEvents();

        verify(outboxService).markPublished(event.getId());
        verify(outboxMetrics).recordEventPublished("MessageQueued");
    }

    @Test
    @DisplayName("A send failure counts a retry and dead-letters the event at the limit")
    void deadLettersAtMaxRetries() {
        OutboxEvent event = event(AggregateType.CREDIT_BALANCE);
        when(outboxService.findPublishableEvents(3, 100)).thenReturn(List.of(event));
        when(kafkaTemplate.send("credit-events", event.getAggregateId().toString(), event.getPayload()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));
        when(outboxService.markFailed(eq(event.getId()), anyString())).thenReturn(3);

        publisher.publishPendingEvents();

        verify(outboxService, never()).markPublished(event.getId());
        verify(outboxMetrics).recordEventPublishFailed("MessageQueued");
        verify(outboxMetrics).recordEventDeadLettered("MessageQueued");
    }

    private static OutboxEvent event(AggregateType type) {
        return OutboxEvent.create(type, UUID.randomUUID(), "MessageQueued", "{\"id\":1}", NOW);
    }
}
