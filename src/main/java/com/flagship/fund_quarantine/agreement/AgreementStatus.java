package com.flagship.fund_quarantine.agreement;

public enum AgreementStatus {
    DRAFT,
    ACTIVE,
    EXPIRED,
    TERMINATED
}
