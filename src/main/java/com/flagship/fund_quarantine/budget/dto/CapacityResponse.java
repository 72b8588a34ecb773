package com.flagship.fund_quarantine.budget.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_quarantine.capacity.Capacity;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class CapacityResponse {

    @JsonProperty("budget_line_id")
    UUID budgetLineId;

    @JsonProperty("allocated_cents")
    long allocatedCents;

    @JsonProperty("spent_cents")
    long spentCents;

    @JsonProperty("reserved_cents")
    long reservedCents;

    @JsonProperty("available_cents")
    long availableCents;

    public static CapacityResponse from(Capacity capacity) {
        return CapacityResponse.builder()
            .budgetLineId(capacity.getBudgetLineId())
            .allocatedCents(capacity.getAllocatedCents())
            .spentCents(capacity.getSpentCents())
            .reservedCents(capacity.getReservedCents())
            .availableCents(capacity.availableCents())
            .build();
    }
}
