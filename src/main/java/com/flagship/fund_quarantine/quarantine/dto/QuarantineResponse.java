package com.flagship.fund_quarantine.quarantine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_quarantine.quarantine.Quarantine;
import com.flagship.fund_quarantine.quarantine.QuarantineStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for a single quarantine.
 */
@Value
@Builder
public class QuarantineResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("budget_line_id")
    UUID budgetLineId;

    @JsonProperty("provider_id")
    UUID providerId;

    @JsonProperty("service_agreement_id")
    UUID serviceAgreementId;

    @JsonProperty("funding_period_id")
    UUID fundingPeriodId;

    @JsonProperty("support_item_code")
    String supportItemCode;

    @JsonProperty("quarantined_cents")
    long quarantinedCents;

    @JsonProperty("used_cents")
    long usedCents;

    @JsonProperty("remaining_cents")
    long remainingCents;

    @JsonProperty("used_percent")
    int usedPercent;

    @JsonProperty("status")
    QuarantineStatus status;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("created_by_id")
    String createdById;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static QuarantineResponse from(Quarantine quarantine) {
        return QuarantineResponse.builder()
            .id(quarantine.getId())
            .budgetLineId(quarantine.getBudgetLineId())
            .providerId(quarantine.getProviderId())
            .serviceAgreementId(quarantine.getServiceAgreementId())
            .fundingPeriodId(quarantine.getFundingPeriodId())
            .supportItemCode(quarantine.getSupportItemCode())
            .quarantinedCents(quarantine.getQuarantinedCents())
            .usedCents(quarantine.getUsedCents())
            .remainingCents(quarantine.remainingCents())
            .usedPercent(quarantine.usedPercent())
            .status(quarantine.getStatus())
            .notes(quarantine.getNotes())
            .createdById(quarantine.getCreatedById())
            .createdAt(quarantine.getCreatedAt())
            .updatedAt(quarantine.getUpdatedAt())
            .build();
    }
}
