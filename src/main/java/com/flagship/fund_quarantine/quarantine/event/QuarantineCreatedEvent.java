package com.flagship.fund_quarantine.quarantine.event;

import com.flagship.fund_quarantine.quarantine.Quarantine;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a quarantine is created, manually or from a service agreement.
 */
@Value
public class QuarantineCreatedEvent implements QuarantineEvent {
    UUID eventId;
    UUID quarantineId;
    UUID budgetLineId;
    UUID providerId;
    long quarantinedCents;
    UUID serviceAgreementId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "quarantine.created";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static QuarantineCreatedEvent from(Quarantine quarantine) {
        return new QuarantineCreatedEvent(
            UUID.randomUUID(),
            quarantine.getId(),
            quarantine.getBudgetLineId(),
            quarantine.getProviderId(),
            quarantine.getQuarantinedCents(),
            quarantine.getServiceAgreementId(),
            Instant.now()
        );
    }
}
