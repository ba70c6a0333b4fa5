package com.casesentinel.job;

import com.casesentinel.core.model.CaseCount;
import com.casesentinel.core.model.CaseRecord;
import com.casesentinel.core.model.GroupingKey;
import com.casesentinel.core.model.Severity;
import com.casesentinel.core.model.TimeRange;
import com.casesentinel.core.store.CaseStore;
import com.casesentinel.core.store.DataAccessException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * {@link CaseStore} over the {@code cases} table. Grouped counting runs in
 * SQL.
 *
 * @since 1.0.0
 */
public class SqliteCaseStore implements CaseStore {

    private static final String COUNT_BY_BU =
            "SELECT business_unit, COUNT(*) AS n FROM cases "
                    + "WHERE created_at >= ? AND created_at < ? "
                    + "GROUP BY business_unit ORDER BY business_unit";

    private static final String COUNT_BY_BU_AND_CATEGORY =
            "SELECT business_unit, category, COUNT(*) AS n FROM cases "
                    + "WHERE created_at >= ? AND created_at < ? "
                    + "GROUP BY business_unit, category ORDER BY business_unit, category";

    private static final String INSERT =
            "INSERT INTO cases (id, business_unit, category, severity, summary, created_at) "
                    + "VALUES (?, ?, ?, ?, ?, ?)";

    private final SqliteDatabase database;

    public SqliteCaseStore(SqliteDatabase database) {
        this.database = Objects.requireNonNull(database, "database must not be null");
    }

    @Override
    public List<CaseCount> countCases(TimeRange range, GroupingKey grouping) {
        Objects.requireNonNull(range, "range must not be null");
        Objects.requireNonNull(grouping, "grouping must not be null");
        boolean withCategory = grouping == GroupingKey.BUSINESS_UNIT_AND_CATEGORY;

        try (Connection conn = database.open();
             PreparedStatement ps = conn.prepareStatement(withCategory ? COUNT_BY_BU_AND_CATEGORY : COUNT_BY_BU)) {
            ps.setLong(1, range.getStart().toEpochMilli());
            ps.setLong(2, range.getEnd().toEpochMilli());
            List<CaseCount> counts = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    counts.add(new CaseCount(rs.getString("business_unit"),
                            withCategory ? rs.getString("category") : null,
                            rs.getInt("n")));
                }
            }
            return counts;
        } catch (SQLException e) {
            throw new DataAccessException("Failed to count cases by " + grouping + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<CaseRecord> findCases(TimeRange range, Set<Severity> severities) {
        Objects.requireNonNull(range, "range must not be null");
        Objects.requireNonNull(severities, "severities must not be null");
        if (severities.isEmpty()) {
            throw new IllegalArgumentException("severities must not be empty");
        }

        String placeholders = String.join(", ", Collections.nCopies(severities.size(), "?"));
        String sql = "SELECT id, business_unit, category, severity, summary, created_at FROM cases "
                + "WHERE created_at >= ? AND created_at < ? AND severity IN (" + placeholders + ") "
                + "ORDER BY created_at, id";

        try (Connection conn = database.open(); PreparedStatement ps = conn.prepareStatement(sql)) {
            int idx = 1;
            ps.setLong(idx++, range.getStart().toEpochMilli());
            ps.setLong(idx++, range.getEnd().toEpochMilli());
            for (Severity severity : severities) {
                ps.setString(idx++, severity.wireName());
            }
            List<CaseRecord> cases = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    cases.add(CaseRecord.builder()
                            .id(rs.getString("id"))
                            .businessUnit(rs.getString("business_unit"))
                            .category(rs.getString("category"))
                            .severity(Severity.fromWireName(rs.getString("severity")))
                            .summary(rs.getString("summary"))
                            .createdAt(Instant.ofEpochMilli(rs.getLong("created_at")))
                            .build());
                }
            }
            return cases;
        } catch (SQLException e) {
            throw new DataAccessException("Failed to fetch cases: " + e.getMessage(), e);
        }
    }

    /**
     * Insert cases in one transaction. Used by ingestion and fixtures.
     */
    public void insertCases(List<CaseRecord> cases) {
        Objects.requireNonNull(cases, "cases must not be null");
        try (Connection conn = database.open()) {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(INSERT)) {
                for (CaseRecord c : cases) {
                    ps.setString(1, c.getId());
                    ps.setString(2, c.getBusinessUnit());
                    ps.setString(3, c.getCategory());
                    ps.setString(4, c.getSeverity().wireName());
                    ps.setString(5, c.getSummary());
                    ps.setLong(6, c.getCreatedAt().toEpochMilli());
                    ps.addBatch();
                }
                ps.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new DataAccessException("Failed to insert " + cases.size() + " case(s): " + e.getMessage(), e);
        }
    }
}
