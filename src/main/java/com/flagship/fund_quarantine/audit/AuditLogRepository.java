package com.flagship.fund_quarantine.audit;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AuditLogRepository extends JpaRepository<AuditLogEntity, UUID> {

    List<AuditLogEntity> findByResourceAndResourceIdOrderByCreatedAtAsc(String resource, String resourceId);
}
