package com.flagship.fund_quarantine.observability;

import com.flagship.fund_quarantine.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the quarantine event outbox.
 *
 * Gauges read cached values that {@link MetricsScheduler} refreshes:
 * - outbox.backlog.size: unpublished events
 * - outbox.backlog.age.seconds: age of the oldest unpublished event
 * - outbox.events.failed: events past the retry limit
 */
@Component
@Slf4j
public class OutboxMetrics {

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;
    private final int maxRetries;

    private final AtomicLong backlogSize = new AtomicLong(0);
    private final AtomicLong oldestEventAgeSeconds = new AtomicLong(0);
    private final AtomicLong failedEventCount = new AtomicLong(0);

    public OutboxMetrics(OutboxEventRepository outboxRepository,
                         MeterRegistry meterRegistry,
                         @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.outboxRepository = outboxRepository;
        this.meterRegistry = meterRegistry;
        this.maxRetries = maxRetries;
    }

    @PostConstruct
    public void init() {
        Gauge.builder("outbox.backlog.size", backlogSize, AtomicLong::get)
                .description("Number of unpublished quarantine events in the outbox")
                .tag("status", "pending")
                .register(meterRegistry);

        Gauge.builder("outbox.backlog.age.seconds", oldestEventAgeSeconds, AtomicLong::get)
                .description("Age of the oldest unpublished event in seconds")
                .register(meterRegistry);

        Gauge.builder("outbox.events.failed", failedEventCount, AtomicLong::get)
                .description("Number of events that exceeded max retry attempts")
                .tag("status", "failed")
                .register(meterRegistry);

        log.info("Outbox metrics registered with Micrometer");
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            long unpublished = outboxRepository.countUnpublished();
            backlogSize.set(unpublished);

            outboxRepository.findOldestUnpublishedCreatedAt()
                    .ifPresentOrElse(
                            oldest -> oldestEventAgeSeconds.set(
                                    Math.max(0, Duration.between(oldest, Instant.now()).getSeconds())),
                            () -> oldestEventAgeSeconds.set(0)
                    );

            long failed = outboxRepository.countByRetryCountGreaterThanEqual(maxRetries);
            failedEventCount.set(failed);

            log.debug("Outbox metrics refreshed: backlog={}, oldestAge={}s, failed={}",
                    unpublished, oldestEventAgeSeconds.get(), failed);

        } catch (Exception e) {
            log.warn("Failed to refresh outbox metrics: {}", e.getMessage());
        }
    }

    public long getBacklogSize() {
        return backlogSize.get();
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("outbox.events.published",
                "event_type", eventType,
                "status", "success"
        ).increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("outbox.events.published",
                "event_type", eventType,
                "status", "failure"
        ).increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("outbox.events.dead_lettered",
                "event_type", eventType
        ).increment();
    }
}
