package com.flagship.fund_quarantine.quarantine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_quarantine.quarantine.NewQuarantine;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.UUID;

/**
 * Request DTO for reserving funds on a budget line.
 */
@Value
public class CreateQuarantineRequest {

    @NotNull(message = "Budget line ID is required")
    @JsonProperty("budget_line_id")
    UUID budgetLineId;

    @NotNull(message = "Provider ID is required")
    @JsonProperty("provider_id")
    UUID providerId;

    @NotNull(message = "Quarantined amount is required")
    @Positive(message = "Quarantined amount must be greater than 0")
    @JsonProperty("quarantined_cents")
    Long quarantinedCents;

    @JsonProperty("service_agreement_id")
    UUID serviceAgreementId;

    @JsonProperty("funding_period_id")
    UUID fundingPeriodId;

    @Size(max = 50, message = "Support item code must be at most 50 characters")
    @JsonProperty("support_item_code")
    String supportItemCode;

    @Size(max = 2000, message = "Notes must be at most 2000 characters")
    @JsonProperty("notes")
    String notes;

    public NewQuarantine toNewQuarantine(String actorId) {
        return NewQuarantine.builder()
            .budgetLineId(budgetLineId)
            .providerId(providerId)
            .quarantinedCents(quarantinedCents)
            .serviceAgreementId(serviceAgreementId)
            .fundingPeriodId(fundingPeriodId)
            .supportItemCode(supportItemCode)
            .notes(notes)
            .actorId(actorId)
            .build();
    }
}
