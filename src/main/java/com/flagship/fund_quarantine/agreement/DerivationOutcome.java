package com.flagship.fund_quarantine.agreement;

/**
 * What happened to one rate line during quarantine derivation.
 */
public enum DerivationOutcome {
    CREATED,
    /** The plan has no budget line for the rate line's category. */
    SKIPPED_NO_CATEGORY,
    SKIPPED_INSUFFICIENT_CAPACITY,
    /** An ACTIVE quarantine already covers this line, provider and support item. */
    SKIPPED_DUPLICATE,
    /** The rate line prices to zero cents, so there is nothing to reserve. */
    SKIPPED_ZERO_AMOUNT,
    /** The rate line prices to a negative amount or one too large for a cent count. */
    SKIPPED_INVALID_AMOUNT;

    public boolean isCreated() {
        return this == CREATED;
    }
}
