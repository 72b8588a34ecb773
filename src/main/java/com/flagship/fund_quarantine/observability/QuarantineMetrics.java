package com.flagship.fund_quarantine.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for quarantine operations.
 *
 * Metrics exposed:
 * - quarantine.operations: lifecycle calls tagged by operation and outcome
 * - quarantine.latency: per-operation timer
 * - quarantine.threshold_reached: utilisation threshold signals
 * - quarantine.derivation.lines: agreement derivation outcome per rate line
 * - quarantine.side_effect.failures: audit/event writes that were swallowed
 * - idempotency.cache: create replays vs new requests
 */
@Component
public class QuarantineMetrics {

    private final MeterRegistry registry;
    private final Counter thresholdReached;

    public QuarantineMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.thresholdReached = Counter.builder("quarantine.threshold_reached")
                .description("Draw-downs that left a quarantine at or above the utilisation threshold")
                .register(registry);
    }

    /**
     * Records a lifecycle operation outcome ("success", "rejected" or "error").
     */
    public void recordOperation(String operation, String outcome) {
        registry.counter("quarantine.operations",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("quarantine.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordThresholdReached() {
        thresholdReached.increment();
    }

    public void recordDerivationOutcome(String outcome) {
        registry.counter("quarantine.derivation.lines",
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    /**
     * Records an audit or event write that failed after the primary write committed.
     */
    public void recordSideEffectFailure(String kind) {
        registry.counter("quarantine.side_effect.failures",
                "kind", sanitizeTag(kind)
        ).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    // Keeps tag cardinality bounded
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
