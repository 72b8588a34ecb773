package com.flagship.fund_quarantine.agreement;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Read model of sa_service_agreements; agreements are maintained elsewhere.
 */
@Entity
@Table(name = "sa_service_agreements")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ServiceAgreementEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "agreement_ref", nullable = false, insertable = false, updatable = false, length = 50)
    private String agreementRef;

    @Column(name = "participant_id", nullable = false, insertable = false, updatable = false)
    private UUID participantId;

    @Column(name = "provider_id", nullable = false, insertable = false, updatable = false)
    private UUID providerId;

    @Column(name = "start_date", nullable = false, insertable = false, updatable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false, insertable = false, updatable = false)
    private LocalDate endDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, insertable = false, updatable = false, length = 20)
    private AgreementStatus status;

    public ServiceAgreement toDomain() {
        return new ServiceAgreement(id, agreementRef, participantId, providerId, startDate, endDate, status);
    }
}
