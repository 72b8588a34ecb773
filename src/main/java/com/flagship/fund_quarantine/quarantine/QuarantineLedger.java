package com.flagship.fund_quarantine.quarantine;

import com.flagship.fund_quarantine.agreement.ServiceAgreementRepository;
import com.flagship.fund_quarantine.budget.BudgetLineRepository;
import com.flagship.fund_quarantine.budget.FundingPeriodRepository;
import com.flagship.fund_quarantine.capacity.CapacityChecker;
import com.flagship.fund_quarantine.quarantine.exception.DuplicateQuarantineException;
import com.flagship.fund_quarantine.quarantine.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Transactional writes to the quarantine ledger.
 *
 * Every method runs the check and the write in one transaction:
 * - writes that change the reserved total of a budget line (create, resize)
 *   lock the budget line row first, so concurrent reservations against the
 *   same line are serialized and the later one sees the earlier commit
 * - writes to an existing quarantine lock its row first
 *
 * Lock order is always quarantine row, then budget line row.
 *
 * A support item code identifies a reservation: at most one ACTIVE quarantine
 * per budget line, provider and code. Quarantines without a code are never
 * duplicates of each other.
 *
 * No side effects happen here; {@link QuarantineService} emits audit records
 * and events once these transactions have committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QuarantineLedger {

    static final String ACTIVE_RESERVATION_INDEX = "uq_fq_quarantines_active_reservation";

    private final QuarantineRepository quarantineRepository;
    private final BudgetLineRepository budgetLineRepository;
    private final FundingPeriodRepository fundingPeriodRepository;
    private final ServiceAgreementRepository serviceAgreementRepository;
    private final CapacityChecker capacityChecker;

    /**
     * Reserves capacity and inserts a new ACTIVE quarantine.
     *
     * @param request Validated creation request
     * @param idempotencyKey Client idempotency key, or null
     * @return The stored quarantine
     * @throws ResourceNotFoundException if the budget line, agreement or funding period does not exist
     * @throws DuplicateQuarantineException if an ACTIVE quarantine exists for the same line, provider and non-null support item
     * @throws com.flagship.fund_quarantine.quarantine.exception.InsufficientCapacityException if the amount does not fit
     */
    @Transactional
    public Quarantine insert(NewQuarantine request, String idempotencyKey) {
        UUID budgetLineId = request.getBudgetLineId();
        budgetLineRepository.findByIdForUpdate(budgetLineId)
            .orElseThrow(() -> ResourceNotFoundException.budgetLine(budgetLineId));

        if (request.getServiceAgreementId() != null
                && !serviceAgreementRepository.existsById(request.getServiceAgreementId())) {
            throw ResourceNotFoundException.serviceAgreement(request.getServiceAgreementId());
        }
        if (request.getFundingPeriodId() != null
                && !fundingPeriodRepository.existsById(request.getFundingPeriodId())) {
            throw ResourceNotFoundException.fundingPeriod(request.getFundingPeriodId());
        }

        ensureNoActiveDuplicate(budgetLineId, request.getProviderId(), request.getSupportItemCode());
        capacityChecker.ensureCapacity(budgetLineId, request.getQuarantinedCents(), null);

        Quarantine quarantine = Quarantine.create(UUID.randomUUID(), request);
        QuarantineEntity saved = flush(QuarantineEntity.fromDomain(quarantine, idempotencyKey), quarantine);

        log.debug("Inserted quarantine {} on budget line {} for {} cents",
                saved.getId(), budgetLineId, saved.getQuarantinedCents());
        return saved.toDomain();
    }

    /**
     * Applies a partial update. A changed amount is re-checked against the
     * line's capacity with this quarantine's own reservation left out.
     */
    @Transactional
    public QuarantineChange amend(UUID quarantineId, QuarantineAmendment amendment) {
        QuarantineEntity entity = lockQuarantine(quarantineId);
        Quarantine current = entity.toDomain();
        Quarantine amended = current.amend(amendment);

        if (amendment.changesAmount(current.getQuarantinedCents())) {
            budgetLineRepository.findByIdForUpdate(current.getBudgetLineId())
                .orElseThrow(() -> ResourceNotFoundException.budgetLine(current.getBudgetLineId()));
            capacityChecker.ensureCapacity(current.getBudgetLineId(), amended.getQuarantinedCents(), quarantineId);
        }
        if (amendment.changesSupportItemCode(current.getSupportItemCode())) {
            ensureNoActiveDuplicate(current.getBudgetLineId(), current.getProviderId(), amended.getSupportItemCode());
        }

        return save(entity, current, amended);
    }

    @Transactional
    public QuarantineChange release(UUID quarantineId) {
        return transition(quarantineId, Quarantine::release);
    }

    @Transactional
    public QuarantineChange expire(UUID quarantineId) {
        return transition(quarantineId, Quarantine::expire);
    }

    /**
     * Adds {@code amountCents} to the quarantine's used amount. Only the
     * quarantine's own ceiling applies; other quarantines are not involved.
     */
    @Transactional
    public QuarantineChange drawDown(UUID quarantineId, long amountCents) {
        return transition(quarantineId, quarantine -> quarantine.drawDown(amountCents));
    }

    @Transactional(readOnly = true)
    public Optional<Quarantine> findById(UUID quarantineId) {
        return quarantineRepository.findById(quarantineId)
            .map(QuarantineEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Quarantine> findByIdempotencyKey(String idempotencyKey) {
        return quarantineRepository.findByIdempotencyKey(idempotencyKey)
            .map(QuarantineEntity::toDomain);
    }

    private QuarantineChange transition(UUID quarantineId, UnaryOperator<Quarantine> transition) {
        QuarantineEntity entity = lockQuarantine(quarantineId);
        Quarantine current = entity.toDomain();
        return save(entity, current, transition.apply(current));
    }

    private QuarantineChange save(QuarantineEntity entity, Quarantine before, Quarantine after) {
        entity.updateFromDomain(after);
        QuarantineEntity saved = flush(entity, after);
        log.debug("Updated quarantine {}: status={}, quarantined={}, used={}",
                saved.getId(), saved.getStatus(), saved.getQuarantinedCents(), saved.getUsedCents());
        return new QuarantineChange(before, saved.toDomain());
    }

    private QuarantineEntity lockQuarantine(UUID quarantineId) {
        return quarantineRepository.findByIdForUpdate(quarantineId)
            .orElseThrow(() -> ResourceNotFoundException.quarantine(quarantineId));
    }

    private void ensureNoActiveDuplicate(UUID budgetLineId, UUID providerId, String supportItemCode) {
        if (supportItemCode == null) {
            return;
        }
        if (quarantineRepository.existsByBudgetLineIdAndProviderIdAndSupportItemCodeAndStatus(
                budgetLineId, providerId, supportItemCode, QuarantineStatus.ACTIVE)) {
            throw new DuplicateQuarantineException(budgetLineId, providerId, supportItemCode);
        }
    }

    /**
     * Saves and flushes, turning a violation of the active reservation index
     * into {@link DuplicateQuarantineException}. Other integrity violations
     * are rethrown unchanged.
     */
    private QuarantineEntity flush(QuarantineEntity entity, Quarantine quarantine) {
        try {
            return quarantineRepository.saveAndFlush(entity);
        } catch (DataIntegrityViolationException e) {
            if (violatesActiveReservationIndex(e)) {
                throw new DuplicateQuarantineException(quarantine.getBudgetLineId(),
                        quarantine.getProviderId(), quarantine.getSupportItemCode());
            }
            throw e;
        }
    }

    static boolean violatesActiveReservationIndex(DataIntegrityViolationException e) {
        for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException
                    && ACTIVE_RESERVATION_INDEX.equalsIgnoreCase(
                        ((ConstraintViolationException) cause).getConstraintName())) {
                return true;
            }
        }
        String message = e.getMostSpecificCause().getMessage();
        return message != null && message.contains(ACTIVE_RESERVATION_INDEX);
    }
}
