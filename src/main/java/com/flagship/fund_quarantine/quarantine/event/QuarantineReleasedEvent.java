package com.flagship.fund_quarantine.quarantine.event;

import com.flagship.fund_quarantine.quarantine.Quarantine;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a quarantine is released and its capacity returns to the budget line.
 */
@Value
public class QuarantineReleasedEvent implements QuarantineEvent {
    UUID eventId;
    UUID quarantineId;
    UUID budgetLineId;
    UUID providerId;
    long releasedCents;
    Instant occurredAt;

    public static final String EVENT_TYPE = "quarantine.released";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static QuarantineReleasedEvent from(Quarantine released) {
        return new QuarantineReleasedEvent(
            UUID.randomUUID(),
            released.getId(),
            released.getBudgetLineId(),
            released.getProviderId(),
            released.remainingCents(),
            Instant.now()
        );
    }
}
