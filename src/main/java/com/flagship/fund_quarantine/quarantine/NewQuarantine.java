package com.flagship.fund_quarantine.quarantine;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Input for creating a quarantine, manually or from a service agreement rate line.
 */
@Value
@Builder
public class NewQuarantine {
    UUID budgetLineId;
    UUID providerId;
    long quarantinedCents;
    UUID serviceAgreementId;
    UUID fundingPeriodId;
    String supportItemCode;
    String notes;
    String actorId;
}
