package com.flagship.fund_quarantine.agreement;

import com.flagship.fund_quarantine.budget.BudgetLine;
import com.flagship.fund_quarantine.budget.BudgetLineEntity;
import com.flagship.fund_quarantine.budget.BudgetLineRepository;
import com.flagship.fund_quarantine.observability.QuarantineMetrics;
import com.flagship.fund_quarantine.quarantine.CreationSource;
import com.flagship.fund_quarantine.quarantine.NewQuarantine;
import com.flagship.fund_quarantine.quarantine.Quarantine;
import com.flagship.fund_quarantine.quarantine.QuarantineService;
import com.flagship.fund_quarantine.quarantine.exception.DuplicateQuarantineException;
import com.flagship.fund_quarantine.quarantine.exception.InsufficientCapacityException;
import com.flagship.fund_quarantine.quarantine.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Creates one quarantine per rate line of a service agreement whose category
 * exists on the target plan.
 *
 * Rate lines are processed in order and each creation commits on its own, so
 * the run is partial by nature: a line that cannot be reserved is skipped and
 * reported, and the rest carry on. Only a missing agreement fails the whole
 * call; unexpected errors propagate and leave earlier lines committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgreementQuarantineDeriver {

    private final ServiceAgreementRepository serviceAgreementRepository;
    private final RateLineRepository rateLineRepository;
    private final BudgetLineRepository budgetLineRepository;
    private final QuarantineService quarantineService;
    private final QuarantineMetrics metrics;

    /**
     * @param serviceAgreementId Agreement whose rate lines are reserved
     * @param planId Plan whose budget lines receive the reservations
     * @param actorId Acting user, recorded as creator and in the audit log
     * @return Outcome of every rate line
     * @throws ResourceNotFoundException if the service agreement does not exist
     */
    public DerivationResult derive(UUID serviceAgreementId, UUID planId, String actorId) {
        if (serviceAgreementId == null || planId == null) {
            throw new IllegalArgumentException("Service agreement ID and plan ID are required");
        }
        if (actorId == null || actorId.isBlank()) {
            throw new IllegalArgumentException("Acting user ID is required");
        }

        ServiceAgreement agreement = serviceAgreementRepository.findById(serviceAgreementId)
            .map(ServiceAgreementEntity::toDomain)
            .orElseThrow(() -> ResourceNotFoundException.serviceAgreement(serviceAgreementId));

        List<RateLine> rateLines = rateLineRepository.findByAgreementIdOrderByCreatedAtAscIdAsc(serviceAgreementId)
            .stream()
            .map(RateLineEntity::toDomain)
            .toList();

        log.info("Deriving quarantines: agreement={}, planId={}, rateLines={}",
                agreement.getAgreementRef(), planId, rateLines.size());

        List<DerivationResult.LineResult> results = new ArrayList<>(rateLines.size());
        for (RateLine rateLine : rateLines) {
            DerivationResult.LineResult result = deriveLine(agreement, planId, rateLine, actorId);
            metrics.recordDerivationOutcome(result.getOutcome().name());
            results.add(result);
        }

        DerivationResult derivation = new DerivationResult(serviceAgreementId, planId, results);
        log.info("Derivation finished: agreement={}, created={}, skipped={}",
                agreement.getAgreementRef(), derivation.createdCount(), results.size() - derivation.createdCount());
        return derivation;
    }

    private DerivationResult.LineResult deriveLine(ServiceAgreement agreement, UUID planId,
                                                   RateLine rateLine, String actorId) {
        Optional<BudgetLine> budgetLine = budgetLineRepository
            .findByPlanIdAndCategoryCode(planId, rateLine.getCategoryCode())
            .map(BudgetLineEntity::toDomain);
        if (budgetLine.isEmpty()) {
            log.debug("Rate line {} skipped: no budget line for category {}",
                    rateLine.getId(), rateLine.getCategoryCode());
            return skipped(rateLine, null, DerivationOutcome.SKIPPED_NO_CATEGORY);
        }

        long amount;
        try {
            amount = rateLine.reservationCents();
        } catch (ArithmeticException e) {
            log.warn("Rate line {} skipped: amount out of range (rate={}, maxQuantity={})",
                    rateLine.getId(), rateLine.getAgreedRateCents(), rateLine.getMaxQuantity());
            return skipped(rateLine, null, DerivationOutcome.SKIPPED_INVALID_AMOUNT);
        }
        if (amount < 0) {
            log.warn("Rate line {} skipped: negative amount {}", rateLine.getId(), amount);
            return skipped(rateLine, amount, DerivationOutcome.SKIPPED_INVALID_AMOUNT);
        }
        if (amount == 0) {
            return skipped(rateLine, amount, DerivationOutcome.SKIPPED_ZERO_AMOUNT);
        }

        NewQuarantine request = NewQuarantine.builder()
            .budgetLineId(budgetLine.get().getId())
            .providerId(agreement.getProviderId())
            .quarantinedCents(amount)
            .serviceAgreementId(agreement.getId())
            .supportItemCode(rateLine.getSupportItemCode())
            .notes("Auto-created from service agreement " + agreement.getAgreementRef())
            .actorId(actorId)
            .build();

        try {
            Quarantine created = quarantineService.create(request, null, CreationSource.SERVICE_AGREEMENT);
            return new DerivationResult.LineResult(rateLine.getId(), rateLine.getCategoryCode(),
                    rateLine.getSupportItemCode(), amount, DerivationOutcome.CREATED, created);

        } catch (InsufficientCapacityException e) {
            log.debug("Rate line {} skipped: requested={}, available={}",
                    rateLine.getId(), e.getRequestedCents(), e.getAvailableCents());
            return skipped(rateLine, amount, DerivationOutcome.SKIPPED_INSUFFICIENT_CAPACITY);
        } catch (DuplicateQuarantineException e) {
            log.debug("Rate line {} skipped: already covered by an active quarantine", rateLine.getId());
            return skipped(rateLine, amount, DerivationOutcome.SKIPPED_DUPLICATE);
        }
    }

    private static DerivationResult.LineResult skipped(RateLine rateLine, Long amount, DerivationOutcome outcome) {
        return new DerivationResult.LineResult(rateLine.getId(), rateLine.getCategoryCode(),
                rateLine.getSupportItemCode(), amount, outcome, null);
    }
}
