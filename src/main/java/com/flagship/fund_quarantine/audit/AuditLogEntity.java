package com.flagship.fund_quarantine.audit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only row of core_audit_logs. Snapshots are stored as jsonb.
 */
@Entity
@Immutable
@Table(name = "core_audit_logs")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AuditLogEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false, length = 100)
    private String userId;

    @Column(nullable = false, updatable = false, length = 100)
    private String action;

    @Column(nullable = false, updatable = false, length = 100)
    private String resource;

    @Column(name = "resource_id", nullable = false, updatable = false, length = 100)
    private String resourceId;

    @Column(name = "before", updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String before;

    @Column(name = "after", updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String after;

    @Column(name = "correlation_id", updatable = false, length = 64)
    private String correlationId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static AuditLogEntity of(AuditRecord record, String beforeJson, String afterJson, String correlationId) {
        return new AuditLogEntity(
            UUID.randomUUID(),
            record.getUserId(),
            record.getAction(),
            record.getResource(),
            record.getResourceId(),
            beforeJson,
            afterJson,
            correlationId,
            null  // set by @PrePersist
        );
    }
}
