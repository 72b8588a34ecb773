package com.flagship.fund_quarantine.observability;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Gauges over the ACTIVE reservations held across all budget lines:
 * - quarantine.active.count: ACTIVE quarantines
 * - quarantine.active.reserved_cents: sum of their quarantined amounts
 * - quarantine.active.used_cents: sum of their drawn-down amounts
 *
 * Values are cached and refreshed by {@link MetricsScheduler}.
 */
@Component
@Slf4j
public class ReservationMetrics {

    static final String ACTIVE_TOTALS_SQL =
        "SELECT COUNT(*), COALESCE(SUM(quarantined_cents), 0), COALESCE(SUM(used_cents), 0) " +
        "FROM fq_quarantines WHERE status = 'ACTIVE'";

    private final JdbcTemplate jdbcTemplate;
    private final MeterRegistry meterRegistry;

    private final AtomicLong activeCount = new AtomicLong(0);
    private final AtomicLong reservedCents = new AtomicLong(0);
    private final AtomicLong usedCents = new AtomicLong(0);

    public ReservationMetrics(JdbcTemplate jdbcTemplate, MeterRegistry meterRegistry) {
        this.jdbcTemplate = jdbcTemplate;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void init() {
        Gauge.builder("quarantine.active.count", activeCount, AtomicLong::get)
                .description("Number of ACTIVE quarantines")
                .register(meterRegistry);

        Gauge.builder("quarantine.active.reserved_cents", reservedCents, AtomicLong::get)
                .description("Cents held by ACTIVE quarantines")
                .baseUnit("cents")
                .register(meterRegistry);

        Gauge.builder("quarantine.active.used_cents", usedCents, AtomicLong::get)
                .description("Cents drawn down against ACTIVE quarantines")
                .baseUnit("cents")
                .register(meterRegistry);
    }

    public void refreshMetrics() {
        try {
            jdbcTemplate.query(ACTIVE_TOTALS_SQL, rs -> {
                activeCount.set(rs.getLong(1));
                reservedCents.set(rs.getLong(2));
                usedCents.set(rs.getLong(3));
            });
            log.debug("Reservation metrics refreshed: active={}, reserved={}, used={}",
                    activeCount.get(), reservedCents.get(), usedCents.get());

        } catch (Exception e) {
            log.warn("Failed to refresh reservation metrics: {}", e.getMessage());
        }
    }

    public long getActiveCount() {
        return activeCount.get();
    }

    public long getReservedCents() {
        return reservedCents.get();
    }

    public long getUsedCents() {
        return usedCents.get();
    }
}
