package com.flagship.fund_quarantine.budget;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Read model of plan_funding_periods, referenced optionally by quarantines.
 */
@Entity
@Table(name = "plan_funding_periods")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class FundingPeriodEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "plan_id", nullable = false, insertable = false, updatable = false)
    private UUID planId;

    @Column(name = "start_date", nullable = false, insertable = false, updatable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false, insertable = false, updatable = false)
    private LocalDate endDate;

    @Column(insertable = false, updatable = false, length = 100)
    private String label;

    @Column(name = "is_active", nullable = false, insertable = false, updatable = false)
    private boolean active;
}
