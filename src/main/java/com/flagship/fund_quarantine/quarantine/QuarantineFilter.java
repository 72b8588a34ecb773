package com.flagship.fund_quarantine.quarantine;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Optional list filters; null fields do not restrict the result.
 */
@Value
@Builder
public class QuarantineFilter {
    UUID budgetLineId;
    UUID providerId;
    UUID serviceAgreementId;
    QuarantineStatus status;
}
