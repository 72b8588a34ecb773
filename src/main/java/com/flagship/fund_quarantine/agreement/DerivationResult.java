package com.flagship.fund_quarantine.agreement;

import com.flagship.fund_quarantine.quarantine.Quarantine;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Per-rate-line report of a derivation run, in rate-line order.
 */
@Value
public class DerivationResult {
    UUID serviceAgreementId;
    UUID planId;
    List<LineResult> lines;

    public List<Quarantine> created() {
        return lines.stream()
            .filter(line -> line.getOutcome().isCreated())
            .map(LineResult::getQuarantine)
            .toList();
    }

    public int createdCount() {
        return (int) lines.stream().filter(line -> line.getOutcome().isCreated()).count();
    }

    @Value
    public static class LineResult {
        UUID rateLineId;
        String categoryCode;
        String supportItemCode;
        /** Null when no amount was computed for the line. */
        Long requestedCents;
        DerivationOutcome outcome;
        /** Null unless the outcome is CREATED. */
        Quarantine quarantine;
    }
}
