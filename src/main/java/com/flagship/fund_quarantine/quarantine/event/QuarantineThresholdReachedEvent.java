package com.flagship.fund_quarantine.quarantine.event;

import com.flagship.fund_quarantine.quarantine.Quarantine;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published after every draw-down that leaves utilisation at or above the
 * configured threshold. It is a notification, not a state change, so it
 * repeats on later qualifying draw-downs; {@code firstCrossing} is true only
 * for the draw-down that moved utilisation from below the threshold.
 */
@Value
public class QuarantineThresholdReachedEvent implements QuarantineEvent {
    UUID eventId;
    UUID quarantineId;
    UUID budgetLineId;
    UUID providerId;
    int usedPercent;
    int previousUsedPercent;
    int thresholdPercent;
    boolean firstCrossing;
    Instant occurredAt;

    public static final String EVENT_TYPE = "quarantine.threshold-reached";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static QuarantineThresholdReachedEvent from(Quarantine before, Quarantine after, int thresholdPercent) {
        int previous = before.usedPercent();
        return new QuarantineThresholdReachedEvent(
            UUID.randomUUID(),
            after.getId(),
            after.getBudgetLineId(),
            after.getProviderId(),
            after.usedPercent(),
            previous,
            thresholdPercent,
            previous < thresholdPercent,
            Instant.now()
        );
    }
}
