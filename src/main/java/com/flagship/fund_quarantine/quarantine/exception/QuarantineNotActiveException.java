package com.flagship.fund_quarantine.quarantine.exception;

import com.flagship.fund_quarantine.quarantine.QuarantineStatus;

import java.util.UUID;

public class QuarantineNotActiveException extends QuarantineException {

    public static final String CODE = "QUARANTINE_NOT_ACTIVE";

    private final QuarantineStatus status;

    public QuarantineNotActiveException(UUID quarantineId, QuarantineStatus status) {
        super(CODE, String.format("Quarantine %s is %s. Only ACTIVE quarantines can be changed.",
                quarantineId, status));
        this.status = status;
    }

    public QuarantineStatus getStatus() {
        return status;
    }
}
