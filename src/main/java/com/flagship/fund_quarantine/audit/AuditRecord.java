package com.flagship.fund_quarantine.audit;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * One structured audit entry: who did what to which resource, with optional
 * before/after snapshots of the fields that changed.
 */
@Value
@Builder
public class AuditRecord {
    String userId;
    String action;
    String resource;
    String resourceId;
    @Singular("beforeValue")
    Map<String, Object> before;
    @Singular("afterValue")
    Map<String, Object> after;
}
