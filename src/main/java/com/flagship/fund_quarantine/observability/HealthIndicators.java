package com.flagship.fund_quarantine.observability;

import com.flagship.fund_quarantine.outbox.OutboxEventRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Custom health indicators for the fund quarantine service.
 *
 * Redis and Kafka are not on the reservation path: reservations keep working
 * when either is down, so those indicators report DEGRADED rather than DOWN
 * where the service can still operate.
 */
public class HealthIndicators {

    /**
     * Unhealthy if too many quarantine events are waiting to be published.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Redis backs the idempotency-key fast path only.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private static final String FALLBACK_NOTE = "Idempotency lookups fall back to the database";

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                var connectionFactory = redisTemplate.getConnectionFactory();
                if (connectionFactory == null) {
                    return Health.status("DEGRADED")
                            .withDetail("error", "No connection factory configured")
                            .withDetail("note", FALLBACK_NOTE)
                            .build();
                }

                String result = connectionFactory.getConnection().ping();
                if ("PONG".equals(result)) {
                    return Health.up()
                            .withDetail("response", result)
                            .build();
                }
                return Health.down()
                        .withDetail("response", result != null ? result : "null")
                        .build();

            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
        }
    }

    /**
     * Kafka receives outbox events; while it is down events accumulate in the outbox.
     */
    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.status("DEGRADED")
                            .withDetail("error", "No Kafka connections established")
                            .withDetail("note", "Events are retained in the outbox until Kafka is reachable")
                            .build();
                }
                return Health.up()
                        .withDetail("metricsCount", metrics.size())
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
