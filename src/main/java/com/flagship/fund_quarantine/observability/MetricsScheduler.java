package com.flagship.fund_quarantine.observability;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes the database-backed gauges on a fixed rate so a scrape reads
 * cached values: outbox backlog and the ACTIVE reservation totals.
 */
@Component
@RequiredArgsConstructor
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final ReservationMetrics reservationMetrics;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshGauges() {
        outboxMetrics.refreshMetrics();
        reservationMetrics.refreshMetrics();
    }
}
