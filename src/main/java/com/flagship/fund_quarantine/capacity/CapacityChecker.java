package com.flagship.fund_quarantine.capacity;

import com.flagship.fund_quarantine.quarantine.exception.InsufficientCapacityException;
import com.flagship.fund_quarantine.quarantine.exception.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Computes budget-line headroom from live aggregates and decides whether a
 * proposed reservation fits.
 *
 * Nothing is cached: every call reads the line and sums ACTIVE quarantines in
 * the caller's transaction. Callers that go on to write must hold the budget
 * line row lock (see {@code BudgetLineRepository#findByIdForUpdate}) so the
 * decision still holds at commit.
 */
@Component
@Slf4j
public class CapacityChecker {

    private static final String BUDGET_LINE_SQL =
        "SELECT allocated_cents, spent_cents FROM plan_budget_lines WHERE id = ?";

    private static final String RESERVED_SQL =
        "SELECT COALESCE(SUM(quarantined_cents), 0) FROM fq_quarantines " +
        "WHERE budget_line_id = ? AND status = 'ACTIVE'";

    private static final String RESERVED_EXCLUDING_SQL = RESERVED_SQL + " AND id <> ?";

    private final JdbcTemplate jdbcTemplate;

    public CapacityChecker(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Current headroom of a budget line.
     *
     * @param budgetLineId Budget line to inspect
     * @param excludeQuarantineId Quarantine whose reservation is left out of the sum, or null
     * @throws ResourceNotFoundException if the budget line does not exist
     */
    @Transactional(readOnly = true)
    public Capacity capacityOf(UUID budgetLineId, UUID excludeQuarantineId) {
        List<long[]> rows = jdbcTemplate.query(
            BUDGET_LINE_SQL,
            (rs, rowNum) -> new long[] { rs.getLong("allocated_cents"), rs.getLong("spent_cents") },
            budgetLineId
        );
        if (rows.isEmpty()) {
            throw ResourceNotFoundException.budgetLine(budgetLineId);
        }

        Long reserved = excludeQuarantineId == null
            ? jdbcTemplate.queryForObject(RESERVED_SQL, Long.class, budgetLineId)
            : jdbcTemplate.queryForObject(RESERVED_EXCLUDING_SQL, Long.class, budgetLineId, excludeQuarantineId);

        long[] line = rows.get(0);
        return new Capacity(budgetLineId, line[0], line[1], reserved != null ? reserved : 0L);
    }

    /**
     * Verifies that {@code proposedCents} fits on the budget line.
     *
     * @return The capacity snapshot the decision was made on
     * @throws IllegalArgumentException if proposedCents is negative
     * @throws ResourceNotFoundException if the budget line does not exist
     * @throws InsufficientCapacityException if the reservation does not fit
     */
    @Transactional(readOnly = true)
    public Capacity ensureCapacity(UUID budgetLineId, long proposedCents, UUID excludeQuarantineId) {
        if (proposedCents < 0) {
            throw new IllegalArgumentException("Proposed amount must not be negative: " + proposedCents);
        }

        Capacity capacity = capacityOf(budgetLineId, excludeQuarantineId);
        if (!capacity.admits(proposedCents)) {
            log.info("Capacity check rejected: budgetLineId={}, requested={}, available={}",
                    budgetLineId, proposedCents, capacity.availableCents());
            throw new InsufficientCapacityException(budgetLineId, proposedCents, capacity.availableCents());
        }

        log.debug("Capacity check passed: budgetLineId={}, requested={}, available={}",
                budgetLineId, proposedCents, capacity.availableCents());
        return capacity;
    }
}
