package com.casesentinel.job;

import com.casesentinel.core.store.DataAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Objects;

/**
 * SQLite database file holding cases, alerts and trending topics.
 *
 * <p>
 * Connections are opened per operation. Timestamps are stored as epoch
 * milliseconds so range filters compare numerically.
 * </p>
 *
 * @since 1.0.0
 */
public class SqliteDatabase {

    private static final Logger LOG = LoggerFactory.getLogger(SqliteDatabase.class);

    private static final List<String> SCHEMA = List.of(
            "CREATE TABLE IF NOT EXISTS cases ("
                    + "id TEXT PRIMARY KEY, "
                    + "business_unit TEXT NOT NULL, "
                    + "category TEXT NOT NULL, "
                    + "severity TEXT NOT NULL, "
                    + "summary TEXT NOT NULL DEFAULT '', "
                    + "created_at INTEGER NOT NULL)",
            "CREATE INDEX IF NOT EXISTS idx_cases_created_at ON cases (created_at)",
            "CREATE TABLE IF NOT EXISTS alerts ("
                    + "id TEXT PRIMARY KEY, "
                    + "type TEXT NOT NULL, "
                    + "severity TEXT NOT NULL, "
                    + "title TEXT NOT NULL, "
                    + "description TEXT NOT NULL, "
                    + "business_unit TEXT NOT NULL, "
                    + "category TEXT, "
                    + "baseline_value INTEGER, "
                    + "current_value INTEGER, "
                    + "percentage_change REAL, "
                    + "status TEXT NOT NULL, "
                    + "created_at INTEGER NOT NULL, "
                    + "updated_at INTEGER NOT NULL)",
            "CREATE TABLE IF NOT EXISTS trending_topics ("
                    + "id TEXT PRIMARY KEY, "
                    + "topic TEXT NOT NULL, "
                    + "description TEXT, "
                    + "case_count INTEGER NOT NULL, "
                    + "baseline_count INTEGER NOT NULL, "
                    + "trend TEXT NOT NULL, "
                    + "percentage_change REAL NOT NULL, "
                    + "trend_score REAL NOT NULL, "
                    + "business_unit TEXT, "
                    + "category TEXT, "
                    + "impacted_business_units TEXT NOT NULL, "
                    + "sample_case_ids TEXT NOT NULL, "
                    + "created_at INTEGER NOT NULL, "
                    + "updated_at INTEGER NOT NULL)");

    private final String url;

    /**
     * Open (and create if needed) the database at {@code path}.
     *
     * @throws DataAccessException if the directory or schema cannot be
     *                             created
     */
    public SqliteDatabase(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        this.url = "jdbc:sqlite:" + path;
        ensureDirectory(path);
        ensureSchema();
        LOG.info("Using SQLite database {}", path.toAbsolutePath());
    }

    Connection open() throws SQLException {
        return DriverManager.getConnection(url);
    }

    private static void ensureDirectory(Path path) {
        Path parent = path.toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new DataAccessException("Failed to create database directory " + parent, e);
        }
    }

    private void ensureSchema() {
        try (Connection conn = open(); Statement st = conn.createStatement()) {
            for (String ddl : SCHEMA) {
                st.executeUpdate(ddl);
            }
        } catch (SQLException e) {
            throw new DataAccessException("Failed to initialise schema at " + url + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "SqliteDatabase{" + url + '}';
    }
}
