package com.flagship.fund_quarantine.quarantine.event;

import com.flagship.fund_quarantine.quarantine.Quarantine;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class QuarantineExpiredEvent implements QuarantineEvent {
    UUID eventId;
    UUID quarantineId;
    UUID budgetLineId;
    UUID providerId;
    long unusedCents;
    Instant occurredAt;

    public static final String EVENT_TYPE = "quarantine.expired";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static QuarantineExpiredEvent from(Quarantine expired) {
        return new QuarantineExpiredEvent(
            UUID.randomUUID(),
            expired.getId(),
            expired.getBudgetLineId(),
            expired.getProviderId(),
            expired.remainingCents(),
            Instant.now()
        );
    }
}
