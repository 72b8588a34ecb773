package com.flagship.fund_quarantine.quarantine.exception;

/**
 * Base class for expected, caller-correctable failures of quarantine operations.
 * Each carries a stable machine-readable code that the API returns verbatim.
 */
public abstract class QuarantineException extends RuntimeException {

    private final String code;

    protected QuarantineException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
