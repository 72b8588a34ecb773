package com.flagship.fund_quarantine.quarantine.exception;

import java.util.UUID;

/**
 * A reservation (or resize) would exceed the remaining headroom of its budget line.
 */
public class InsufficientCapacityException extends QuarantineException {

    public static final String CODE = "INSUFFICIENT_BUDGET_CAPACITY";

    private final UUID budgetLineId;
    private final long requestedCents;
    private final long availableCents;

    public InsufficientCapacityException(UUID budgetLineId, long requestedCents, long availableCents) {
        super(CODE, String.format("Insufficient capacity on budget line %s: requested=%d, available=%d",
                budgetLineId, requestedCents, availableCents));
        this.budgetLineId = budgetLineId;
        this.requestedCents = requestedCents;
        this.availableCents = availableCents;
    }

    public UUID getBudgetLineId() {
        return budgetLineId;
    }

    public long getRequestedCents() {
        return requestedCents;
    }

    public long getAvailableCents() {
        return availableCents;
    }
}
