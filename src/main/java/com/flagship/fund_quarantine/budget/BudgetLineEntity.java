package com.flagship.fund_quarantine.budget;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Read model of plan_budget_lines. No column is updatable from this service:
 * the entity exists to resolve lines and to take the row lock that serializes
 * reservations against one line.
 */
@Entity
@Table(name = "plan_budget_lines")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BudgetLineEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "plan_id", nullable = false, insertable = false, updatable = false)
    private UUID planId;

    @Column(name = "category_code", nullable = false, insertable = false, updatable = false, length = 50)
    private String categoryCode;

    @Column(name = "category_name", nullable = false, insertable = false, updatable = false, length = 200)
    private String categoryName;

    @Column(name = "allocated_cents", nullable = false, insertable = false, updatable = false)
    private long allocatedCents;

    @Column(name = "spent_cents", nullable = false, insertable = false, updatable = false)
    private long spentCents;

    public BudgetLine toDomain() {
        return new BudgetLine(id, planId, categoryCode, categoryName, allocatedCents, spentCents);
    }
}
