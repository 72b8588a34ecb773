package com.flagship.fund_quarantine.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An event waiting in (or already drained from) the outbox.
 *
 * The outbox decouples the quarantine write path from Kafka: lifecycle
 * operations only insert a row, and {@link OutboxPublisher} delivers it later
 * with its own retry and dead-letter policy.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null  // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    /**
     * An event that failed {@code maxRetries} times is dead-lettered and left for manual replay.
     */
    public boolean isDeadLettered(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}
