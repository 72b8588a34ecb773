package com.flagship.fund_quarantine.agreement;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "sa_rate_lines")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class RateLineEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "agreement_id", nullable = false, insertable = false, updatable = false)
    private UUID agreementId;

    @Column(name = "category_code", nullable = false, insertable = false, updatable = false, length = 50)
    private String categoryCode;

    @Column(name = "category_name", nullable = false, insertable = false, updatable = false, length = 200)
    private String categoryName;

    @Column(name = "support_item_code", insertable = false, updatable = false, length = 50)
    private String supportItemCode;

    @Column(name = "agreed_rate_cents", nullable = false, insertable = false, updatable = false)
    private long agreedRateCents;

    @Column(name = "max_quantity", insertable = false, updatable = false, precision = 10, scale = 2)
    private BigDecimal maxQuantity;

    @Column(name = "unit_type", insertable = false, updatable = false, length = 20)
    private String unitType;

    @Column(name = "created_at", insertable = false, updatable = false)
    private Instant createdAt;

    public RateLine toDomain() {
        return new RateLine(id, agreementId, categoryCode, categoryName, supportItemCode,
                agreedRateCents, maxQuantity, unitType);
    }
}
