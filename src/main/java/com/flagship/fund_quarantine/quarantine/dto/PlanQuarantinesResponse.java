package com.flagship.fund_quarantine.quarantine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_quarantine.quarantine.Quarantine;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A plan's quarantines grouped by provider.
 */
@Value
@Builder
public class PlanQuarantinesResponse {

    @JsonProperty("plan_id")
    UUID planId;

    @JsonProperty("providers")
    List<ProviderQuarantines> providers;

    public static PlanQuarantinesResponse from(UUID planId, Map<UUID, List<Quarantine>> byProvider) {
        List<ProviderQuarantines> providers = byProvider.entrySet().stream()
            .map(entry -> ProviderQuarantines.builder()
                .providerId(entry.getKey())
                .totalQuarantinedCents(entry.getValue().stream().mapToLong(Quarantine::getQuarantinedCents).sum())
                .quarantines(entry.getValue().stream().map(QuarantineResponse::from).toList())
                .build())
            .toList();
        return PlanQuarantinesResponse.builder()
            .planId(planId)
            .providers(providers)
            .build();
    }

    @Value
    @Builder
    public static class ProviderQuarantines {

        @JsonProperty("provider_id")
        UUID providerId;

        @JsonProperty("total_quarantined_cents")
        long totalQuarantinedCents;

        @JsonProperty("quarantines")
        List<QuarantineResponse> quarantines;
    }
}
