package com.flagship.fund_quarantine.agreement;

import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Negotiated agreement between a participant and a provider. Read-only input
 * to quarantine derivation.
 */
@Value
public class ServiceAgreement {
    UUID id;
    String agreementRef;
    UUID participantId;
    UUID providerId;
    LocalDate startDate;
    LocalDate endDate;
    AgreementStatus status;
}
