package com.flagship.fund_quarantine.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Writes quarantine events to the outbox and serves the publisher.
 *
 * Lifecycle operations enqueue only after their own transaction has committed,
 * and every enqueue runs in a fresh transaction. A failed enqueue therefore
 * never rolls back a reservation; the caller logs and moves on.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Serializes {@code payload} to JSON and stores it as an unpublished event.
     *
     * @param aggregateType Type of the aggregate (e.g. "Quarantine")
     * @param aggregateId ID of the aggregate, used as the Kafka key
     * @param eventType Topic-style event name (e.g. "quarantine.created")
     * @param payload Event payload object
     * @return The stored event
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public OutboxEvent enqueue(String aggregateType, UUID aggregateId,
                               String eventType, Object payload) {
        String jsonPayload = serializePayload(payload);

        OutboxEvent event = OutboxEvent.create(aggregateType, aggregateId, eventType, jsonPayload);
        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(event));

        log.debug("Enqueued outbox event: type={}, aggregateType={}, aggregateId={}",
                eventType, aggregateType, aggregateId);

        return saved.toDomain();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findPublishableEvents(int limit, int maxRetries) {
        return repository.findPublishableForUpdate(limit, maxRetries)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished();
            repository.save(entity);
            log.debug("Marked event {} as published", eventId);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Marked event {} as failed (retry #{}): {}",
                    eventId, entity.getRetryCount(), errorMessage);
        });
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(
                aggregateType, aggregateId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getDeadLetterEvents(int maxRetries) {
        return repository.findDeadLetterEvents(maxRetries)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
