package com.flagship.fund_quarantine.quarantine;

import com.flagship.fund_quarantine.observability.QuarantineMetrics;
import com.flagship.fund_quarantine.quarantine.dto.CreateQuarantineRequest;
import com.flagship.fund_quarantine.quarantine.dto.DrawDownRequest;
import com.flagship.fund_quarantine.quarantine.dto.PlanQuarantinesResponse;
import com.flagship.fund_quarantine.quarantine.dto.QuarantineResponse;
import com.flagship.fund_quarantine.quarantine.dto.UpdateQuarantineRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * REST controller for the quarantine lifecycle.
 *
 * Every write needs the acting user in the X-User-Id header. Create also
 * accepts an optional Idempotency-Key: a replay returns the quarantine that
 * the first request created, with 200 instead of 201.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class QuarantineController {

    static final String USER_ID_HEADER = "X-User-Id";
    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final QuarantineService quarantineService;
    private final QuarantineQueryService queryService;
    private final IdempotencyService idempotencyService;
    private final QuarantineMetrics metrics;

    @PostMapping("/api/quarantines")
    public ResponseEntity<QuarantineResponse> create(
            @Valid @RequestBody CreateQuarantineRequest request,
            @RequestHeader(USER_ID_HEADER) String actorId,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        log.info("Received quarantine creation request: budgetLineId={}, providerId={}, quarantinedCents={}, idempotencyKey={}",
                request.getBudgetLineId(), request.getProviderId(), request.getQuarantinedCents(), idempotencyKey);

        boolean idempotent = idempotencyKey != null && !idempotencyKey.isBlank();
        if (idempotent) {
            Optional<ResponseEntity<QuarantineResponse>> replay = replay(idempotencyKey);
            if (replay.isPresent()) {
                return replay.get();
            }
            metrics.recordIdempotencyMiss();
        }

        Quarantine created;
        try {
            created = quarantineService.create(request.toNewQuarantine(actorId), idempotent ? idempotencyKey : null);
        } catch (DataIntegrityViolationException e) {
            // A concurrent request with the same key may have won the insert
            if (idempotent) {
                Optional<ResponseEntity<QuarantineResponse>> replay = replay(idempotencyKey);
                if (replay.isPresent()) {
                    return replay.get();
                }
            }
            throw e;
        }

        if (idempotent) {
            idempotencyService.storeIdempotencyKey(idempotencyKey, created.getId());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(QuarantineResponse.from(created));
    }

    @GetMapping("/api/quarantines")
    public ResponseEntity<List<QuarantineResponse>> list(
            @RequestParam(name = "budget_line_id", required = false) UUID budgetLineId,
            @RequestParam(name = "provider_id", required = false) UUID providerId,
            @RequestParam(name = "service_agreement_id", required = false) UUID serviceAgreementId,
            @RequestParam(name = "status", required = false) QuarantineStatus status) {

        QuarantineFilter filter = QuarantineFilter.builder()
            .budgetLineId(budgetLineId)
            .providerId(providerId)
            .serviceAgreementId(serviceAgreementId)
            .status(status)
            .build();
        List<QuarantineResponse> body = queryService.list(filter).stream()
            .map(QuarantineResponse::from)
            .toList();
        return ResponseEntity.ok(body);
    }

    @GetMapping("/api/quarantines/{id}")
    public ResponseEntity<QuarantineResponse> get(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(QuarantineResponse.from(queryService.get(id)));
    }

    @PatchMapping("/api/quarantines/{id}")
    public ResponseEntity<QuarantineResponse> update(
            @PathVariable("id") UUID id,
            @Valid @RequestBody UpdateQuarantineRequest request,
            @RequestHeader(USER_ID_HEADER) String actorId) {
        Quarantine updated = quarantineService.update(id, request.toAmendment(), actorId);
        return ResponseEntity.ok(QuarantineResponse.from(updated));
    }

    @PostMapping("/api/quarantines/{id}/release")
    public ResponseEntity<QuarantineResponse> release(
            @PathVariable("id") UUID id,
            @RequestHeader(USER_ID_HEADER) String actorId) {
        return ResponseEntity.ok(QuarantineResponse.from(quarantineService.release(id, actorId)));
    }

    @PostMapping("/api/quarantines/{id}/expire")
    public ResponseEntity<QuarantineResponse> expire(
            @PathVariable("id") UUID id,
            @RequestHeader(USER_ID_HEADER) String actorId) {
        return ResponseEntity.ok(QuarantineResponse.from(quarantineService.expire(id, actorId)));
    }

    @PostMapping("/api/quarantines/{id}/draw-downs")
    public ResponseEntity<QuarantineResponse> drawDown(
            @PathVariable("id") UUID id,
            @Valid @RequestBody DrawDownRequest request,
            @RequestHeader(USER_ID_HEADER) String actorId) {
        Quarantine drawn = quarantineService.drawDown(id, request.getAmountCents(), actorId);
        return ResponseEntity.ok(QuarantineResponse.from(drawn));
    }

    @GetMapping("/api/plans/{planId}/quarantines")
    public ResponseEntity<PlanQuarantinesResponse> listForPlan(
            @PathVariable("planId") UUID planId,
            @RequestParam(name = "status", required = false) QuarantineStatus status) {
        return ResponseEntity.ok(
            PlanQuarantinesResponse.from(planId, queryService.listForPlanByProvider(planId, status)));
    }

    private Optional<ResponseEntity<QuarantineResponse>> replay(String idempotencyKey) {
        Optional<UUID> existingId = idempotencyService.checkIdempotencyKey(idempotencyKey);
        if (existingId.isEmpty()) {
            return Optional.empty();
        }
        metrics.recordIdempotencyHit();
        log.info("Idempotency key already used, returning existing quarantine: quarantineId={}", existingId.get());
        return Optional.of(ResponseEntity.ok(QuarantineResponse.from(queryService.get(existingId.get()))));
    }
}
