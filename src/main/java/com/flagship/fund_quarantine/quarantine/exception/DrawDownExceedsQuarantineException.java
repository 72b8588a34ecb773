package com.flagship.fund_quarantine.quarantine.exception;

import java.util.UUID;

public class DrawDownExceedsQuarantineException extends QuarantineException {

    public static final String CODE = "DRAW_DOWN_EXCEEDS_QUARANTINE";

    private final long requestedCents;
    private final long remainingCents;

    public DrawDownExceedsQuarantineException(UUID quarantineId, long requestedCents, long remainingCents) {
        super(CODE, String.format("Draw-down of %d exceeds the %d remaining on quarantine %s",
                requestedCents, remainingCents, quarantineId));
        this.requestedCents = requestedCents;
        this.remainingCents = remainingCents;
    }

    public long getRequestedCents() {
        return requestedCents;
    }

    public long getRemainingCents() {
        return remainingCents;
    }
}
