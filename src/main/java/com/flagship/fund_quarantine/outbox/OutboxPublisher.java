package com.flagship.fund_quarantine.outbox;

import com.flagship.fund_quarantine.observability.OutboxMetrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Drains the outbox to the quarantine Kafka topic.
 *
 * Each poll takes a batch of publishable events, sends them one by one keyed
 * by quarantine id (partition affinity keeps per-quarantine order), and marks
 * each row published once the broker acknowledges. A failed send increments
 * the retry count; at {@code outbox.publisher.max-retries} the event is
 * dead-lettered and no longer polled.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class OutboxPublisher {

    static final String EVENT_TYPE_HEADER = "event_type";
    static final String EVENT_ID_HEADER = "event_id";
    private static final long SEND_TIMEOUT_SECONDS = 10;

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;
    private final String topic;
    private final int batchSize;
    private final int maxRetries;

    public OutboxPublisher(OutboxService outboxService,
                           KafkaTemplate<String, String> kafkaTemplate,
                           OutboxMetrics outboxMetrics,
                           @Value("${kafka.topic.quarantines:fund-quarantine}") String topic,
                           @Value("${outbox.publisher.batch-size:100}") int batchSize,
                           @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.outboxService = outboxService;
        this.kafkaTemplate = kafkaTemplate;
        this.outboxMetrics = outboxMetrics;
        this.topic = topic;
        this.batchSize = batchSize;
        this.maxRetries = maxRetries;
    }

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findPublishableEvents(batchSize, maxRetries);
            if (events.isEmpty()) {
                return;
            }

            log.debug("Found {} unpublished events to process", events.size());
            for (OutboxEvent event : events) {
                publishEvent(event);
            }

        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    private void publishEvent(OutboxEvent event) {
        if (event.isDeadLettered(maxRetries)) {
            log.warn("Event {} has exceeded max retries ({}), leaving it dead-lettered. eventType={}, aggregateId={}",
                    event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
            outboxMetrics.recordEventDeadLettered(event.getEventType());
            return;
        }

        ProducerRecord<String, String> record = new ProducerRecord<>(
                topic, event.getAggregateId().toString(), event.getPayload());
        record.headers().add(EVENT_TYPE_HEADER, event.getEventType().getBytes(StandardCharsets.UTF_8));
        record.headers().add(EVENT_ID_HEADER, event.getId().toString().getBytes(StandardCharsets.UTF_8));

        try {
            SendResult<String, String> result = kafkaTemplate.send(record)
                    .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "Interrupted while publishing");
            outboxMetrics.recordEventPublishFailed(event.getEventType());
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());
        }
    }

    /**
     * Runs one poll immediately.
     */
    public void triggerPublish() {
        publishPendingEvents();
    }
}
