package com.flagship.fund_quarantine.agreement;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.UUID;

/**
 * A negotiated price term on a service agreement.
 */
@Value
public class RateLine {
    UUID id;
    UUID agreementId;
    String categoryCode;
    String categoryName;
    String supportItemCode;
    long agreedRateCents;
    BigDecimal maxQuantity;
    String unitType;

    /**
     * Amount to reserve for this line: {@code maxQuantity * agreedRateCents},
     * or the rate alone when no maximum quantity was agreed. Fractional cents
     * are rounded half-up.
     *
     * @throws ArithmeticException if the amount does not fit in a long
     */
    public long reservationCents() {
        BigDecimal quantity = maxQuantity != null ? maxQuantity : BigDecimal.ONE;
        return quantity
            .multiply(BigDecimal.valueOf(agreedRateCents))
            .setScale(0, RoundingMode.HALF_UP)
            .longValueExact();
    }
}
