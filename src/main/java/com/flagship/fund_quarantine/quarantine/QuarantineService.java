package com.flagship.fund_quarantine.quarantine;

import com.flagship.fund_quarantine.audit.AuditLogService;
import com.flagship.fund_quarantine.audit.AuditRecord;
import com.flagship.fund_quarantine.observability.CorrelationContext;
import com.flagship.fund_quarantine.observability.QuarantineMetrics;
import com.flagship.fund_quarantine.outbox.OutboxService;
import com.flagship.fund_quarantine.quarantine.event.QuarantineCreatedEvent;
import com.flagship.fund_quarantine.quarantine.event.QuarantineEvent;
import com.flagship.fund_quarantine.quarantine.event.QuarantineExpiredEvent;
import com.flagship.fund_quarantine.quarantine.event.QuarantineReleasedEvent;
import com.flagship.fund_quarantine.quarantine.event.QuarantineThresholdReachedEvent;
import com.flagship.fund_quarantine.quarantine.exception.QuarantineException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Quarantine lifecycle manager: create, update, release, expire and draw-down.
 *
 * Each operation validates its input, runs the check-and-write in a
 * {@link QuarantineLedger} transaction and, once that has committed, writes
 * the audit record and enqueues the lifecycle event. Those two side effects
 * are best-effort: a failure is logged and counted but never reaches the
 * caller and never undoes the committed write.
 *
 * Not transactional; each ledger call commits on its own.
 */
@Service
@Slf4j
public class QuarantineService {

    public static final String AGGREGATE_TYPE = "Quarantine";
    public static final String AUDIT_RESOURCE = "fund-quarantine";

    static final String ACTION_UPDATED = "fund-quarantine.updated";
    static final String ACTION_RELEASED = "fund-quarantine.released";
    static final String ACTION_EXPIRED = "fund-quarantine.expired";
    static final String ACTION_DRAW_DOWN = "fund-quarantine.draw-down";

    static final int MAX_SUPPORT_ITEM_CODE_LENGTH = 50;
    static final int MAX_NOTES_LENGTH = 2000;

    private final QuarantineLedger ledger;
    private final AuditLogService auditLogService;
    private final OutboxService outboxService;
    private final QuarantineMetrics metrics;
    private final int thresholdPercent;

    public QuarantineService(QuarantineLedger ledger,
                             AuditLogService auditLogService,
                             OutboxService outboxService,
                             QuarantineMetrics metrics,
                             @Value("${quarantine.threshold.percent:80}") int thresholdPercent) {
        if (thresholdPercent < 1 || thresholdPercent > 100) {
            throw new IllegalArgumentException("quarantine.threshold.percent must be between 1 and 100");
        }
        this.ledger = ledger;
        this.auditLogService = auditLogService;
        this.outboxService = outboxService;
        this.metrics = metrics;
        this.thresholdPercent = thresholdPercent;
    }

    public Quarantine create(NewQuarantine request, String idempotencyKey) {
        return create(request, idempotencyKey, CreationSource.MANUAL);
    }

    /**
     * Creates an ACTIVE quarantine after checking the budget line's capacity.
     *
     * @param request Creation request
     * @param idempotencyKey Client idempotency key stored with the quarantine, or null
     * @param source Manual request or service agreement derivation
     * @return The created quarantine
     * @throws IllegalArgumentException if the request is invalid
     * @throws com.flagship.fund_quarantine.quarantine.exception.InsufficientCapacityException if the amount does not fit
     */
    public Quarantine create(NewQuarantine request, String idempotencyKey, CreationSource source) {
        return execute("create", null, () -> {
            validate(request);

            Quarantine created = ledger.insert(request, idempotencyKey);
            MDC.put(CorrelationContext.QUARANTINE_ID_MDC_KEY, created.getId().toString());

            AuditRecord.AuditRecordBuilder audit = AuditRecord.builder()
                .userId(request.getActorId())
                .action(source.getAuditAction())
                .resource(AUDIT_RESOURCE)
                .resourceId(created.getId().toString())
                .afterValue("budgetLineId", created.getBudgetLineId())
                .afterValue("providerId", created.getProviderId())
                .afterValue("quarantinedCents", created.getQuarantinedCents())
                .afterValue("serviceAgreementId", created.getServiceAgreementId());
            if (source.getAuditSource() != null) {
                audit.afterValue("source", source.getAuditSource());
            }
            audit(audit.build());
            publish(QuarantineCreatedEvent.from(created));

            log.info("Quarantine created: budgetLineId={}, providerId={}, quarantinedCents={}, source={}",
                    created.getBudgetLineId(), created.getProviderId(), created.getQuarantinedCents(), source);
            return created;
        });
    }

    /**
     * Partially updates an ACTIVE quarantine. Omitted fields are unchanged.
     *
     * @throws com.flagship.fund_quarantine.quarantine.exception.ResourceNotFoundException if it does not exist
     * @throws com.flagship.fund_quarantine.quarantine.exception.QuarantineNotActiveException if it is not ACTIVE
     * @throws com.flagship.fund_quarantine.quarantine.exception.InsufficientCapacityException if a new amount does not fit
     */
    public Quarantine update(UUID quarantineId, QuarantineAmendment amendment, String actorId) {
        return execute("update", quarantineId, () -> {
            requireActor(actorId);
            validate(amendment);

            QuarantineChange change = ledger.amend(quarantineId, amendment);

            audit(AuditRecord.builder()
                .userId(actorId)
                .action(ACTION_UPDATED)
                .resource(AUDIT_RESOURCE)
                .resourceId(quarantineId.toString())
                .beforeValue("quarantinedCents", change.getBefore().getQuarantinedCents())
                .afterValue("quarantinedCents", change.getAfter().getQuarantinedCents())
                .build());

            log.info("Quarantine updated: quarantinedCents {} -> {}",
                    change.getBefore().getQuarantinedCents(), change.getAfter().getQuarantinedCents());
            return change.getAfter();
        });
    }

    /**
     * ACTIVE -> RELEASED. The reserved amount returns to the budget line.
     */
    public Quarantine release(UUID quarantineId, String actorId) {
        return execute("release", quarantineId, () -> {
            requireActor(actorId);

            QuarantineChange change = ledger.release(quarantineId);
            Quarantine released = change.getAfter();

            audit(AuditRecord.builder()
                .userId(actorId)
                .action(ACTION_RELEASED)
                .resource(AUDIT_RESOURCE)
                .resourceId(quarantineId.toString())
                .beforeValue("status", change.getBefore().getStatus().name())
                .afterValue("status", released.getStatus().name())
                .build());
            publish(QuarantineReleasedEvent.from(released));

            log.info("Quarantine released: budgetLineId={}, usedCents={}, freedCents={}",
                    released.getBudgetLineId(), released.getUsedCents(), released.remainingCents());
            return released;
        });
    }

    /**
     * ACTIVE -> EXPIRED, typically when the funding period closes.
     */
    public Quarantine expire(UUID quarantineId, String actorId) {
        return execute("expire", quarantineId, () -> {
            requireActor(actorId);

            QuarantineChange change = ledger.expire(quarantineId);
            Quarantine expired = change.getAfter();

            audit(AuditRecord.builder()
                .userId(actorId)
                .action(ACTION_EXPIRED)
                .resource(AUDIT_RESOURCE)
                .resourceId(quarantineId.toString())
                .beforeValue("status", change.getBefore().getStatus().name())
                .afterValue("status", expired.getStatus().name())
                .build());
            publish(QuarantineExpiredEvent.from(expired));

            log.info("Quarantine expired: budgetLineId={}, unusedCents={}",
                    expired.getBudgetLineId(), expired.remainingCents());
            return expired;
        });
    }

    /**
     * Consumes part of the reservation. Publishes a threshold event whenever the
     * resulting utilisation is at or above the configured threshold.
     *
     * @throws com.flagship.fund_quarantine.quarantine.exception.DrawDownExceedsQuarantineException if usedCents would exceed quarantinedCents
     */
    public Quarantine drawDown(UUID quarantineId, long amountCents, String actorId) {
        return execute("draw_down", quarantineId, () -> {
            requireActor(actorId);
            if (amountCents <= 0) {
                throw new IllegalArgumentException("Draw-down amount must be positive");
            }

            QuarantineChange change = ledger.drawDown(quarantineId, amountCents);
            Quarantine after = change.getAfter();

            audit(AuditRecord.builder()
                .userId(actorId)
                .action(ACTION_DRAW_DOWN)
                .resource(AUDIT_RESOURCE)
                .resourceId(quarantineId.toString())
                .beforeValue("usedCents", change.getBefore().getUsedCents())
                .afterValue("usedCents", after.getUsedCents())
                .build());

            int usedPercent = after.usedPercent();
            if (usedPercent >= thresholdPercent) {
                QuarantineThresholdReachedEvent event =
                    QuarantineThresholdReachedEvent.from(change.getBefore(), after, thresholdPercent);
                publish(event);
                metrics.recordThresholdReached();
                log.info("Quarantine utilisation threshold reached: usedPercent={}, firstCrossing={}",
                        usedPercent, event.isFirstCrossing());
            }

            log.info("Quarantine drawn down: amountCents={}, usedCents={}/{}",
                    amountCents, after.getUsedCents(), after.getQuarantinedCents());
            return after;
        });
    }

    public int getThresholdPercent() {
        return thresholdPercent;
    }

    private <T> T execute(String operation, UUID quarantineId, Supplier<T> action) {
        long startTime = System.currentTimeMillis();
        if (quarantineId != null) {
            MDC.put(CorrelationContext.QUARANTINE_ID_MDC_KEY, quarantineId.toString());
        }

        try {
            T result = action.get();
            metrics.recordOperation(operation, "success");
            return result;

        } catch (QuarantineException | IllegalArgumentException e) {
            metrics.recordOperation(operation, "rejected");
            log.warn("Quarantine {} rejected: {}", operation, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            metrics.recordOperation(operation, "error");
            log.error("Quarantine {} failed: error={}", operation, e.getMessage());
            throw e;
        } finally {
            metrics.recordLatency(operation, System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.QUARANTINE_ID_MDC_KEY);
        }
    }

    private void audit(AuditRecord record) {
        try {
            auditLogService.record(record);
        } catch (Exception e) {
            metrics.recordSideEffectFailure("audit");
            log.warn("Audit write failed, continuing: action={}, resourceId={}, error={}",
                    record.getAction(), record.getResourceId(), e.getMessage());
        }
    }

    private void publish(QuarantineEvent event) {
        try {
            outboxService.enqueue(AGGREGATE_TYPE, event.getQuarantineId(), event.getEventType(), event);
        } catch (Exception e) {
            metrics.recordSideEffectFailure("event");
            log.warn("Event enqueue failed, continuing: eventType={}, quarantineId={}, error={}",
                    event.getEventType(), event.getQuarantineId(), e.getMessage());
        }
    }

    private void validate(NewQuarantine request) {
        if (request == null) {
            throw new IllegalArgumentException("Quarantine request is required");
        }
        if (request.getBudgetLineId() == null) {
            throw new IllegalArgumentException("Budget line ID is required");
        }
        if (request.getProviderId() == null) {
            throw new IllegalArgumentException("Provider ID is required");
        }
        if (request.getQuarantinedCents() <= 0) {
            throw new IllegalArgumentException("Quarantined amount must be a positive number of cents");
        }
        requireActor(request.getActorId());
        validateText("Support item code", request.getSupportItemCode(), MAX_SUPPORT_ITEM_CODE_LENGTH);
        validateText("Notes", request.getNotes(), MAX_NOTES_LENGTH);
    }

    private void validate(QuarantineAmendment amendment) {
        if (amendment == null || amendment.isEmpty()) {
            throw new IllegalArgumentException("At least one field must be supplied");
        }
        if (amendment.getQuarantinedCents() != null && amendment.getQuarantinedCents() <= 0) {
            throw new IllegalArgumentException("Quarantined amount must be a positive number of cents");
        }
        validateText("Support item code", amendment.getSupportItemCode(), MAX_SUPPORT_ITEM_CODE_LENGTH);
        validateText("Notes", amendment.getNotes(), MAX_NOTES_LENGTH);
    }

    private static void validateText(String field, String value, int maxLength) {
        if (value != null && value.length() > maxLength) {
            throw new IllegalArgumentException(field + " must be at most " + maxLength + " characters");
        }
    }

    private static void requireActor(String actorId) {
        if (actorId == null || actorId.isBlank()) {
            throw new IllegalArgumentException("Acting user ID is required");
        }
    }
}
