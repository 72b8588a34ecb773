package com.flagship.fund_quarantine.quarantine;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for fq_quarantines.
 *
 * - no setters: state changes go through the {@link Quarantine} transitions
 *   and are copied back with {@link #updateFromDomain(Quarantine)}
 * - references (budget line, provider, agreement, period) and the creator are not updatable
 * - the database CHECK keeps 0 <= used_cents <= quarantined_cents even if code misbehaves
 *
 * The idempotency key is a persistence concern and is passed separately in
 * {@link #fromDomain(Quarantine, String)}.
 */
@Entity
@Table(name = "fq_quarantines")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class QuarantineEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "budget_line_id", nullable = false, updatable = false)
    private UUID budgetLineId;

    @Column(name = "provider_id", nullable = false, updatable = false)
    private UUID providerId;

    @Column(name = "service_agreement_id", updatable = false)
    private UUID serviceAgreementId;

    @Column(name = "funding_period_id", updatable = false)
    private UUID fundingPeriodId;

    @Column(name = "support_item_code", length = 50)
    private String supportItemCode;

    @Column(name = "quarantined_cents", nullable = false)
    private long quarantinedCents;

    @Column(name = "used_cents", nullable = false)
    private long usedCents;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private QuarantineStatus status;

    @Column(length = 2000)
    private String notes;

    @Column(name = "created_by_id", nullable = false, updatable = false, length = 100)
    private String createdById;

    @Column(name = "idempotency_key", updatable = false, unique = true)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static QuarantineEntity fromDomain(Quarantine quarantine, String idempotencyKey) {
        return new QuarantineEntity(
            quarantine.getId(),
            quarantine.getBudgetLineId(),
            quarantine.getProviderId(),
            quarantine.getServiceAgreementId(),
            quarantine.getFundingPeriodId(),
            quarantine.getSupportItemCode(),
            quarantine.getQuarantinedCents(),
            quarantine.getUsedCents(),
            quarantine.getStatus(),
            quarantine.getNotes(),
            quarantine.getCreatedById(),
            idempotencyKey,
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    public Quarantine toDomain() {
        return new Quarantine(
            id,
            budgetLineId,
            providerId,
            serviceAgreementId,
            fundingPeriodId,
            supportItemCode,
            quarantinedCents,
            usedCents,
            status,
            notes,
            createdById,
            createdAt,
            updatedAt
        );
    }

    /**
     * Copies the mutable fields of a transitioned domain object.
     * Timestamps are handled by @PreUpdate.
     */
    void updateFromDomain(Quarantine quarantine) {
        if (!quarantine.getId().equals(this.id)) {
            throw new IllegalArgumentException(
                "Cannot apply quarantine " + quarantine.getId() + " to entity " + this.id);
        }
        this.supportItemCode = quarantine.getSupportItemCode();
        this.quarantinedCents = quarantine.getQuarantinedCents();
        this.usedCents = quarantine.getUsedCents();
        this.status = quarantine.getStatus();
        this.notes = quarantine.getNotes();
    }
}
