package com.flagship.fund_quarantine.agreement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

@Value
public class DeriveQuarantinesRequest {

    @NotNull(message = "Plan ID is required")
    @JsonProperty("plan_id")
    UUID planId;
}
