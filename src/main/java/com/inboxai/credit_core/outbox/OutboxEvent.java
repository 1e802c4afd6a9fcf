package com.inboxai.credit_core.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A domain event waiting in the outbox table.
 *
 * Written in the same transaction as the state change it describes, then relayed to
 * Kafka by {@link OutboxPublisher}. Immutable; state changes return new instances.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // see AggregateType
    UUID aggregateId;          // Kafka key
    String eventType;          // e.g. "CreditsDeducted"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(AggregateType aggregateType, UUID aggregateId,
                                     String eventType, String payload, Instant createdAt) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType.label(),
            aggregateId,
            eventType,
            payload,
            createdAt,
            null,
            0,
            null,
            null   // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLettered(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }

    public OutboxEvent markPublished(Instant at) {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload,
            createdAt, at, retryCount, null, sequenceNumber);
    }

    public OutboxEvent markRetry(String errorMessage) {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload,
            createdAt, publishedAt, retryCount + 1, errorMessage, sequenceNumber);
    }
}
