package com.flagship.fund_quarantine.quarantine.exception;

import java.util.UUID;

/**
 * A referenced budget line, quarantine, service agreement or funding period does not exist.
 */
public class ResourceNotFoundException extends QuarantineException {

    public static final String QUARANTINE_NOT_FOUND = "NOT_FOUND";
    public static final String BUDGET_LINE_NOT_FOUND = "BUDGET_LINE_NOT_FOUND";
    public static final String SERVICE_AGREEMENT_NOT_FOUND = "SERVICE_AGREEMENT_NOT_FOUND";
    public static final String FUNDING_PERIOD_NOT_FOUND = "FUNDING_PERIOD_NOT_FOUND";

    private ResourceNotFoundException(String code, String message) {
        super(code, message);
    }

    public static ResourceNotFoundException quarantine(UUID id) {
        return new ResourceNotFoundException(QUARANTINE_NOT_FOUND, "Quarantine not found: " + id);
    }

    public static ResourceNotFoundException budgetLine(UUID id) {
        return new ResourceNotFoundException(BUDGET_LINE_NOT_FOUND, "Budget line not found: " + id);
    }

    public static ResourceNotFoundException serviceAgreement(UUID id) {
        return new ResourceNotFoundException(SERVICE_AGREEMENT_NOT_FOUND, "Service agreement not found: " + id);
    }

    public static ResourceNotFoundException fundingPeriod(UUID id) {
        return new ResourceNotFoundException(FUNDING_PERIOD_NOT_FOUND, "Funding period not found: " + id);
    }
}
