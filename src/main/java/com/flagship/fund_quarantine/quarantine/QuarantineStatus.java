package com.flagship.fund_quarantine.quarantine;

/**
 * ACTIVE is the only status that holds capacity and accepts changes.
 * RELEASED and EXPIRED are terminal.
 */
public enum QuarantineStatus {
    ACTIVE,
    RELEASED,
    EXPIRED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
