package com.flagship.fund_quarantine.agreement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_quarantine.agreement.DerivationOutcome;
import com.flagship.fund_quarantine.agreement.DerivationResult;
import com.flagship.fund_quarantine.quarantine.dto.QuarantineResponse;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Quarantines created from a service agreement, plus what happened to each rate line.
 */
@Value
@Builder
public class DerivationResponse {

    @JsonProperty("service_agreement_id")
    UUID serviceAgreementId;

    @JsonProperty("plan_id")
    UUID planId;

    @JsonProperty("count")
    int count;

    @JsonProperty("data")
    List<QuarantineResponse> data;

    @JsonProperty("lines")
    List<LineOutcome> lines;

    public static DerivationResponse from(DerivationResult result) {
        return DerivationResponse.builder()
            .serviceAgreementId(result.getServiceAgreementId())
            .planId(result.getPlanId())
            .count(result.createdCount())
            .data(result.created().stream().map(QuarantineResponse::from).toList())
            .lines(result.getLines().stream().map(LineOutcome::from).toList())
            .build();
    }

    @Value
    @Builder
    public static class LineOutcome {

        @JsonProperty("rate_line_id")
        UUID rateLineId;

        @JsonProperty("category_code")
        String categoryCode;

        @JsonProperty("support_item_code")
        String supportItemCode;

        @JsonProperty("requested_cents")
        Long requestedCents;

        @JsonProperty("outcome")
        DerivationOutcome outcome;

        @JsonProperty("quarantine_id")
        UUID quarantineId;

        static LineOutcome from(DerivationResult.LineResult line) {
            return LineOutcome.builder()
                .rateLineId(line.getRateLineId())
                .categoryCode(line.getCategoryCode())
                .supportItemCode(line.getSupportItemCode())
                .requestedCents(line.getRequestedCents())
                .outcome(line.getOutcome())
                .quarantineId(line.getQuarantine() != null ? line.getQuarantine().getId() : null)
                .build();
        }
    }
}
