package com.flagship.fund_quarantine.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.fund_quarantine.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

/**
 * Durable audit sink.
 *
 * Each record is written in its own transaction so that callers can invoke it
 * after their primary write has committed and treat any failure as non-fatal.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditLogService {

    private final AuditLogRepository repository;
    private final ObjectMapper objectMapper;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void record(AuditRecord record) {
        if (record.getUserId() == null || record.getUserId().isBlank()) {
            throw new IllegalArgumentException("Audit record requires a user id");
        }

        AuditLogEntity entity = AuditLogEntity.of(
            record,
            toJson(record.getBefore()),
            toJson(record.getAfter()),
            CorrelationContext.currentOrNull()
        );
        repository.save(entity);

        log.debug("Audit recorded: action={}, resource={}, resourceId={}",
                record.getAction(), record.getResource(), record.getResourceId());
    }

    @Transactional(readOnly = true)
    public List<AuditLogEntity> findForResource(String resource, String resourceId) {
        return repository.findByResourceAndResourceIdOrderByCreatedAtAsc(resource, resourceId);
    }

    private String toJson(Map<String, Object> snapshot) {
        if (snapshot == null || snapshot.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize audit snapshot", e);
        }
    }
}
