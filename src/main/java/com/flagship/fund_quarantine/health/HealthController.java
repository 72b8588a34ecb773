package com.flagship.fund_quarantine.health;

import com.flagship.fund_quarantine.observability.OutboxMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness/readiness probe. Unlike the Actuator health endpoint, this does
 * not require authorization.
 *
 * Only the database gates readiness; the outbox backlog is reported for information.
 */
@RestController
@Slf4j
public class HealthController {

    private final JdbcTemplate jdbcTemplate;
    private final OutboxMetrics outboxMetrics;

    public HealthController(JdbcTemplate jdbcTemplate, OutboxMetrics outboxMetrics) {
        this.jdbcTemplate = jdbcTemplate;
        this.outboxMetrics = outboxMetrics;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("service", "fund-quarantine");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");
        response.put("outboxBacklog", outboxMetrics.getBacklogSize());

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try {
            Integer one = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return one != null && one == 1;
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }
}
