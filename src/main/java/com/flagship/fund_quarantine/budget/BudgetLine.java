package com.flagship.fund_quarantine.budget;

import lombok.Value;

import java.util.UUID;

/**
 * A per-category ceiling within a participant's plan.
 *
 * {@code allocatedCents} and {@code spentCents} are owned by the plan and
 * invoice approval flows; this service only reads them.
 */
@Value
public class BudgetLine {
    UUID id;
    UUID planId;
    String categoryCode;
    String categoryName;
    long allocatedCents;
    long spentCents;

    /**
     * Allocation not yet consumed by approved spend, before any reservations.
     */
    public long unspentCents() {
        return allocatedCents - spentCents;
    }
}
