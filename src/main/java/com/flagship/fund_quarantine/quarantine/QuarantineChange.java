package com.flagship.fund_quarantine.quarantine;

import lombok.Value;

/**
 * A committed transition: the quarantine as loaded under lock and as saved.
 */
@Value
public class QuarantineChange {
    Quarantine before;
    Quarantine after;
}
