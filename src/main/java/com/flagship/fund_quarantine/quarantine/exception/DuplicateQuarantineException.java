package com.flagship.fund_quarantine.quarantine.exception;

import java.util.UUID;

/**
 * An ACTIVE quarantine already exists for the same budget line, provider and support item.
 */
public class DuplicateQuarantineException extends QuarantineException {

    public static final String CODE = "DUPLICATE_QUARANTINE";

    public DuplicateQuarantineException(UUID budgetLineId, UUID providerId, String supportItemCode) {
        super(CODE, String.format(
                "An active quarantine already exists for budget line %s, provider %s, support item %s",
                budgetLineId, providerId, supportItemCode == null ? "(none)" : supportItemCode));
    }
}
