package com.flagship.fund_quarantine.quarantine;

import com.flagship.fund_quarantine.quarantine.exception.DrawDownExceedsQuarantineException;
import com.flagship.fund_quarantine.quarantine.exception.QuarantineNotActiveException;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

/**
 * Quarantine domain object: a reservation of budget-line capacity for one provider.
 *
 * Key rules:
 * - 0 <= usedCents <= quarantinedCents at all times
 * - only ACTIVE quarantines change; RELEASED and EXPIRED are terminal
 * - every transition returns a new instance
 *
 * Capacity across quarantines is not checked here; that needs the budget line
 * and is done by {@link QuarantineLedger} under a row lock.
 */
@Value
public class Quarantine {
    UUID id;
    UUID budgetLineId;
    UUID providerId;
    UUID serviceAgreementId;
    UUID fundingPeriodId;
    String supportItemCode;
    long quarantinedCents;
    long usedCents;
    QuarantineStatus status;
    String notes;
    String createdById;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new ACTIVE quarantine with nothing drawn down.
     */
    public static Quarantine create(UUID id, NewQuarantine request) {
        if (request.getQuarantinedCents() <= 0) {
            throw new IllegalArgumentException("Quarantined amount must be positive");
        }
        Instant now = Instant.now();
        return new Quarantine(
            id,
            request.getBudgetLineId(),
            request.getProviderId(),
            request.getServiceAgreementId(),
            request.getFundingPeriodId(),
            request.getSupportItemCode(),
            request.getQuarantinedCents(),
            0L,
            QuarantineStatus.ACTIVE,
            request.getNotes(),
            request.getActorId(),
            now,
            now
        );
    }

    public boolean isActive() {
        return status == QuarantineStatus.ACTIVE;
    }

    public long remainingCents() {
        return quarantinedCents - usedCents;
    }

    /**
     * Utilisation as a whole percentage, rounded half-up.
     */
    public int usedPercent() {
        return percentOf(usedCents, quarantinedCents);
    }

    /**
     * Applies a partial update. Only the fields present in {@code amendment} change.
     *
     * @throws QuarantineNotActiveException if this quarantine is not ACTIVE
     * @throws IllegalArgumentException if the new amount is not positive or is below usedCents
     */
    public Quarantine amend(QuarantineAmendment amendment) {
        requireActive();

        long newQuarantined = quarantinedCents;
        if (amendment.getQuarantinedCents() != null) {
            newQuarantined = amendment.getQuarantinedCents();
            if (newQuarantined <= 0) {
                throw new IllegalArgumentException("Quarantined amount must be positive");
            }
            if (newQuarantined < usedCents) {
                throw new IllegalArgumentException(String.format(
                    "Quarantined amount %d cannot be below the %d already drawn down", newQuarantined, usedCents));
            }
        }

        return new Quarantine(
            id,
            budgetLineId,
            providerId,
            serviceAgreementId,
            fundingPeriodId,
            amendment.isSupportItemCodeSet() ? amendment.getSupportItemCode() : supportItemCode,
            newQuarantined,
            usedCents,
            status,
            amendment.isNotesSet() ? amendment.getNotes() : notes,
            createdById,
            createdAt,
            Instant.now()
        );
    }

    /**
     * Records consumption of part of the reservation.
     *
     * @throws IllegalArgumentException if amountCents is not positive
     * @throws QuarantineNotActiveException if this quarantine is not ACTIVE
     * @throws DrawDownExceedsQuarantineException if usedCents would exceed quarantinedCents
     */
    public Quarantine drawDown(long amountCents) {
        if (amountCents <= 0) {
            throw new IllegalArgumentException("Draw-down amount must be positive");
        }
        requireActive();
        if (amountCents > remainingCents()) {
            throw new DrawDownExceedsQuarantineException(id, amountCents, remainingCents());
        }
        return withUsedAndStatus(usedCents + amountCents, status);
    }

    /**
     * ACTIVE -> RELEASED. Frees the reservation; usedCents is kept.
     */
    public Quarantine release() {
        requireActive();
        return withUsedAndStatus(usedCents, QuarantineStatus.RELEASED);
    }

    /**
     * ACTIVE -> EXPIRED. Treated like RELEASED for capacity.
     */
    public Quarantine expire() {
        requireActive();
        return withUsedAndStatus(usedCents, QuarantineStatus.EXPIRED);
    }

    static int percentOf(long part, long whole) {
        if (whole <= 0) {
            return 0;
        }
        return BigDecimal.valueOf(part)
            .multiply(BigDecimal.valueOf(100))
            .divide(BigDecimal.valueOf(whole), 0, RoundingMode.HALF_UP)
            .intValueExact();
    }

    private void requireActive() {
        if (status != QuarantineStatus.ACTIVE) {
            throw new QuarantineNotActiveException(id, status);
        }
    }

    private Quarantine withUsedAndStatus(long newUsed, QuarantineStatus newStatus) {
        return new Quarantine(
            id,
            budgetLineId,
            providerId,
            serviceAgreementId,
            fundingPeriodId,
            supportItemCode,
            quarantinedCents,
            newUsed,
            newStatus,
            notes,
            createdById,
            createdAt,
            Instant.now()
        );
    }
}
