package com.flagship.fund_quarantine.quarantine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_quarantine.quarantine.QuarantineAmendment;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Getter;

/**
 * PATCH body. A field that is absent is left alone; a text field sent as
 * {@code null} is cleared.
 */
@Getter
public class UpdateQuarantineRequest {

    @Positive(message = "Quarantined amount must be greater than 0")
    private Long quarantinedCents;

    @Size(max = 50, message = "Support item code must be at most 50 characters")
    private String supportItemCode;
    private boolean supportItemCodePresent;

    @Size(max = 2000, message = "Notes must be at most 2000 characters")
    private String notes;
    private boolean notesPresent;

    @JsonProperty("quarantined_cents")
    public void setQuarantinedCents(Long quarantinedCents) {
        this.quarantinedCents = quarantinedCents;
    }

    @JsonProperty("support_item_code")
    public void setSupportItemCode(String supportItemCode) {
        this.supportItemCode = supportItemCode;
        this.supportItemCodePresent = true;
    }

    @JsonProperty("notes")
    public void setNotes(String notes) {
        this.notes = notes;
        this.notesPresent = true;
    }

    public QuarantineAmendment toAmendment() {
        return QuarantineAmendment.builder()
            .quarantinedCents(quarantinedCents)
            .supportItemCodeSet(supportItemCodePresent)
            .supportItemCode(supportItemCode)
            .notesSet(notesPresent)
            .notes(notes)
            .build();
    }
}
