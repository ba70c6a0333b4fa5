package com.casesentinel.job;

import com.casesentinel.core.model.Alert;
import com.casesentinel.core.model.AlertStatus;
import com.casesentinel.core.model.AlertType;
import com.casesentinel.core.model.Severity;
import com.casesentinel.core.model.TrendDirection;
import com.casesentinel.core.model.TrendingTopic;
import com.casesentinel.core.store.AlertStore;
import com.casesentinel.core.store.DataAccessException;
import com.casesentinel.core.store.TrendingTopicStore;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Append-only store for the {@code alerts} and {@code trending_topics}
 * tables. Each batch is written in a single transaction.
 *
 * @since 1.0.0
 */
public class SqliteAlertStore implements AlertStore, TrendingTopicStore {

    private static final String INSERT_ALERT =
            "INSERT INTO alerts (id, type, severity, title, description, business_unit, category, "
                    + "baseline_value, current_value, percentage_change, status, created_at, updated_at) "
                    + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String INSERT_TOPIC =
            "INSERT INTO trending_topics (id, topic, description, case_count, baseline_count, trend, "
                    + "percentage_change, trend_score, business_unit, category, impacted_business_units, "
                    + "sample_case_ids, created_at, updated_at) "
                    + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private final SqliteDatabase database;

    public SqliteAlertStore(SqliteDatabase database) {
        this.database = Objects.requireNonNull(database, "database must not be null");
    }

    @Override
    public void insertAlerts(List<Alert> alerts) {
        Objects.requireNonNull(alerts, "alerts must not be null");
        inTransaction(INSERT_ALERT, "alert", alerts.size(), ps -> {
            for (Alert a : alerts) {
                int idx = 1;
                ps.setString(idx++, Objects.requireNonNull(a.getId(), "alert id must not be null"));
                ps.setString(idx++, a.getType().wireName());
                ps.setString(idx++, a.getSeverity().wireName());
                ps.setString(idx++, a.getTitle());
                ps.setString(idx++, a.getDescription());
                ps.setString(idx++, a.getBusinessUnit());
                ps.setString(idx++, a.getCategory());
                setNullableInt(ps, idx++, a.getBaselineValue());
                setNullableInt(ps, idx++, a.getCurrentValue());
                if (a.getPercentageChange() == null) {
                    ps.setNull(idx++, Types.REAL);
                } else {
                    ps.setDouble(idx++, a.getPercentageChange());
                }
                ps.setString(idx++, a.getStatus().wireName());
                ps.setLong(idx++, a.getCreatedAt().toEpochMilli());
                ps.setLong(idx, a.getUpdatedAt().toEpochMilli());
                ps.addBatch();
            }
        });
    }

    @Override
    public void insertTopics(List<TrendingTopic> topics) {
        Objects.requireNonNull(topics, "topics must not be null");
        inTransaction(INSERT_TOPIC, "trending topic", topics.size(), ps -> {
            for (TrendingTopic t : topics) {
                int idx = 1;
                ps.setString(idx++, Objects.requireNonNull(t.getId(), "topic id must not be null"));
                ps.setString(idx++, t.getTopic());
                ps.setString(idx++, t.getDescription());
                ps.setInt(idx++, t.getCaseCount());
                ps.setInt(idx++, t.getBaselineCount());
                ps.setString(idx++, t.getDirection().wireName());
                ps.setDouble(idx++, t.getPercentageChange());
                ps.setDouble(idx++, t.getTrendScore());
                ps.setString(idx++, t.getBusinessUnit());
                ps.setString(idx++, t.getCategory());
                ps.setString(idx++, JsonSupport.writeStringList(t.getImpactedBusinessUnits()));
                ps.setString(idx++, JsonSupport.writeStringList(t.getSampleCaseIds()));
                ps.setLong(idx++, t.getCreatedAt().toEpochMilli());
                ps.setLong(idx, t.getUpdatedAt().toEpochMilli());
                ps.addBatch();
            }
        });
    }

    /**
     * @return every stored alert, oldest first
     */
    public List<Alert> findAlerts() {
        String sql = "SELECT * FROM alerts ORDER BY created_at, rowid";
        try (Connection conn = database.open();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            List<Alert> alerts = new ArrayList<>();
            while (rs.next()) {
                alerts.add(Alert.builder()
                        .id(rs.getString("id"))
                        .type(AlertType.fromWireName(rs.getString("type")))
                        .severity(Severity.fromWireName(rs.getString("severity")))
                        .title(rs.getString("title"))
                        .description(rs.getString("description"))
                        .businessUnit(rs.getString("business_unit"))
                        .category(rs.getString("category"))
                        .baselineValue(getNullableInt(rs, "baseline_value"))
                        .currentValue(getNullableInt(rs, "current_value"))
                        .percentageChange(getNullableDouble(rs, "percentage_change"))
                        .status(AlertStatus.fromWireName(rs.getString("status")))
                        .createdAt(Instant.ofEpochMilli(rs.getLong("created_at")))
                        .updatedAt(Instant.ofEpochMilli(rs.getLong("updated_at")))
                        .build());
            }
            return alerts;
        } catch (SQLException e) {
            throw new DataAccessException("Failed to read alerts: " + e.getMessage(), e);
        }
    }

    /**
     * @return every stored trending topic, oldest first
     */
    public List<TrendingTopic> findTopics() {
        String sql = "SELECT * FROM trending_topics ORDER BY created_at, rowid";
        try (Connection conn = database.open();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            List<TrendingTopic> topics = new ArrayList<>();
            while (rs.next()) {
                topics.add(TrendingTopic.builder()
                        .id(rs.getString("id"))
                        .topic(rs.getString("topic"))
                        .description(rs.getString("description"))
                        .caseCount(rs.getInt("case_count"))
                        .baselineCount(rs.getInt("baseline_count"))
                        .direction(TrendDirection.fromWireName(rs.getString("trend")))
                        .percentageChange(rs.getDouble("percentage_change"))
                        .trendScore(rs.getDouble("trend_score"))
                        .businessUnit(rs.getString("business_unit"))
                        .category(rs.getString("category"))
                        .impactedBusinessUnits(JsonSupport.readStringList(rs.getString("impacted_business_units")))
                        .sampleCaseIds(JsonSupport.readStringList(rs.getString("sample_case_ids")))
                        .createdAt(Instant.ofEpochMilli(rs.getLong("created_at")))
                        .updatedAt(Instant.ofEpochMilli(rs.getLong("updated_at")))
                        .build());
            }
            return topics;
        } catch (SQLException e) {
            throw new DataAccessException("Failed to read trending topics: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    @FunctionalInterface
    private interface BatchBinder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private void inTransaction(String sql, String what, int size, BatchBinder binder) {
        if (size == 0) {
            return;
        }
        try (Connection conn = database.open()) {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                binder.bind(ps);
                ps.executeBatch();
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new DataAccessException("Failed to insert " + size + " " + what + "(s): " + e.getMessage(), e);
        }
    }

    private static void setNullableInt(PreparedStatement ps, int idx, Integer value) throws SQLException {
        if (value == null) {
            ps.setNull(idx, Types.INTEGER);
        } else {
            ps.setInt(idx, value);
        }
    }

    private static Integer getNullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private static Double getNullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }
}
