package com.flagship.fund_quarantine.capacity;

import lombok.Value;

import java.util.UUID;

/**
 * Snapshot of a budget line's headroom.
 *
 * <pre>
 * available = allocated - spent - reserved
 * </pre>
 * where {@code reserved} is the sum of ACTIVE quarantines on the line (minus
 * any quarantine excluded when the snapshot was taken). All values are cents.
 * {@code available} may be negative if spend grew after reservations were made.
 */
@Value
public class Capacity {
    UUID budgetLineId;
    long allocatedCents;
    long spentCents;
    long reservedCents;

    public long availableCents() {
        return allocatedCents - spentCents - reservedCents;
    }

    /**
     * Whether a reservation of {@code proposedCents} fits in the remaining headroom.
     *
     * @throws IllegalArgumentException if proposedCents is negative
     */
    public boolean admits(long proposedCents) {
        if (proposedCents < 0) {
            throw new IllegalArgumentException("Proposed amount must not be negative: " + proposedCents);
        }
        return availableCents() >= proposedCents;
    }
}
