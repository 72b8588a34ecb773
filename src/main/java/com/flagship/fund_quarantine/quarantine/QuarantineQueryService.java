package com.flagship.fund_quarantine.quarantine;

import com.flagship.fund_quarantine.capacity.Capacity;
import com.flagship.fund_quarantine.capacity.CapacityChecker;
import com.flagship.fund_quarantine.quarantine.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read side of the quarantine ledger: lookups, filtered lists and capacity views.
 * Lists are newest first.
 */
@Service
@RequiredArgsConstructor
public class QuarantineQueryService {

    private static final String SELECT_COLUMNS =
        "SELECT q.id, q.budget_line_id, q.provider_id, q.service_agreement_id, q.funding_period_id, " +
        "q.support_item_code, q.quarantined_cents, q.used_cents, q.status, q.notes, q.created_by_id, " +
        "q.created_at, q.updated_at FROM fq_quarantines q";

    private final JdbcTemplate jdbcTemplate;
    private final CapacityChecker capacityChecker;

    @Transactional(readOnly = true)
    public Quarantine get(UUID quarantineId) {
        List<Quarantine> found = jdbcTemplate.query(
            SELECT_COLUMNS + " WHERE q.id = ?", quarantineRowMapper(), quarantineId);
        if (found.isEmpty()) {
            throw ResourceNotFoundException.quarantine(quarantineId);
        }
        return found.get(0);
    }

    @Transactional(readOnly = true)
    public List<Quarantine> list(QuarantineFilter filter) {
        StringBuilder sql = new StringBuilder(SELECT_COLUMNS).append(" WHERE 1 = 1");
        List<Object> args = new ArrayList<>();

        if (filter.getBudgetLineId() != null) {
            sql.append(" AND q.budget_line_id = ?");
            args.add(filter.getBudgetLineId());
        }
        if (filter.getProviderId() != null) {
            sql.append(" AND q.provider_id = ?");
            args.add(filter.getProviderId());
        }
        if (filter.getServiceAgreementId() != null) {
            sql.append(" AND q.service_agreement_id = ?");
            args.add(filter.getServiceAgreementId());
        }
        if (filter.getStatus() != null) {
            sql.append(" AND q.status = ?");
            args.add(filter.getStatus().name());
        }
        sql.append(" ORDER BY q.created_at DESC, q.id");

        return jdbcTemplate.query(sql.toString(), quarantineRowMapper(), args.toArray());
    }

    /**
     * All quarantines on a plan's budget lines, grouped by provider.
     *
     * @param status Optional status filter
     * @return Provider ID to quarantines, providers ordered by their newest quarantine
     */
    @Transactional(readOnly = true)
    public Map<UUID, List<Quarantine>> listForPlanByProvider(UUID planId, QuarantineStatus status) {
        String sql = SELECT_COLUMNS +
            " JOIN plan_budget_lines b ON b.id = q.budget_line_id WHERE b.plan_id = ?" +
            (status != null ? " AND q.status = ?" : "") +
            " ORDER BY q.created_at DESC, q.id";
        Object[] args = status != null ? new Object[] { planId, status.name() } : new Object[] { planId };

        Map<UUID, List<Quarantine>> byProvider = new LinkedHashMap<>();
        for (Quarantine quarantine : jdbcTemplate.query(sql, quarantineRowMapper(), args)) {
            byProvider.computeIfAbsent(quarantine.getProviderId(), id -> new ArrayList<>()).add(quarantine);
        }
        return byProvider;
    }

    @Transactional(readOnly = true)
    public Capacity capacity(UUID budgetLineId) {
        return capacityChecker.capacityOf(budgetLineId, null);
    }

    private RowMapper<Quarantine> quarantineRowMapper() {
        return (rs, rowNum) -> new Quarantine(
            uuid(rs, "id"),
            uuid(rs, "budget_line_id"),
            uuid(rs, "provider_id"),
            uuid(rs, "service_agreement_id"),
            uuid(rs, "funding_period_id"),
            rs.getString("support_item_code"),
            rs.getLong("quarantined_cents"),
            rs.getLong("used_cents"),
            QuarantineStatus.valueOf(rs.getString("status")),
            rs.getString("notes"),
            rs.getString("created_by_id"),
            instant(rs.getTimestamp("created_at")),
            instant(rs.getTimestamp("updated_at"))
        );
    }

    private static UUID uuid(ResultSet rs, String column) throws SQLException {
        String value = rs.getString(column);
        return value != null ? UUID.fromString(value) : null;
    }

    private static java.time.Instant instant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
