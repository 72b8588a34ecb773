package com.flagship.fund_quarantine.quarantine;

/**
 * Where a quarantine came from. Drives the audit action and the audit "source" field.
 */
public enum CreationSource {
    MANUAL("fund-quarantine.created", null),
    SERVICE_AGREEMENT("fund-quarantine.auto-created", "auto-create-from-sa");

    private final String auditAction;
    private final String auditSource;

    CreationSource(String auditAction, String auditSource) {
        this.auditAction = auditAction;
        this.auditSource = auditSource;
    }

    public String getAuditAction() {
        return auditAction;
    }

    public String getAuditSource() {
        return auditSource;
    }
}
