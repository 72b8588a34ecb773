package com.flagship.fund_quarantine.quarantine;

import lombok.Builder;
import lombok.Value;

import java.util.Objects;

/**
 * Partial update of a quarantine.
 *
 * A null {@code quarantinedCents} leaves the amount unchanged. The text fields
 * carry an explicit "set" flag so that a caller can clear them to null.
 */
@Value
@Builder
public class QuarantineAmendment {
    Long quarantinedCents;
    boolean supportItemCodeSet;
    String supportItemCode;
    boolean notesSet;
    String notes;

    public boolean changesAmount(long currentCents) {
        return quarantinedCents != null && quarantinedCents != currentCents;
    }

    public boolean changesSupportItemCode(String currentCode) {
        return supportItemCodeSet && !Objects.equals(supportItemCode, currentCode);
    }

    public boolean isEmpty() {
        return quarantinedCents == null && !supportItemCodeSet && !notesSet;
    }
}
