package com.slicebot.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Idempotent PostgreSQL schema migration runner.
 */
public final class MigrationRunner {
    private static final Logger LOG = LogManager.getLogger(MigrationRunner.class);
    private static final int TARGET_VERSION = 1;

    public void run(Database database) throws SQLException {
        try (Connection conn = database.connect(); Statement st = conn.createStatement()) {
            st.execute("CREATE SCHEMA IF NOT EXISTS " + database.schema());
            st.execute("SET search_path TO " + database.schema() + ", public");
            st.execute("CREATE TABLE IF NOT EXISTS run_metadata (" +
                    "meta_key TEXT PRIMARY KEY," +
                    "meta_value TEXT NOT NULL," +
                    "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                    ")");

            int currentVersion = readSchemaVersion(conn);
            String lastSql = "";
            try {
                for (String sql : buildStatements()) {
                    lastSql = sql;
                    st.execute(sql);
                }
                writeSchemaVersion(conn, TARGET_VERSION);
            } catch (SQLException e) {
                String detail = "migration_failed: schema_version=" + currentVersion
                        + ", target_version=" + TARGET_VERSION
                        + ", failed_sql=" + summarizeSql(lastSql)
                        + ", cause=" + safe(e.getMessage());
                LOG.error(detail);
                throw new SQLException(detail, e.getSQLState(), e.getErrorCode(), e);
            }
            if (currentVersion != TARGET_VERSION) {
                LOG.info("schema migrated from version {} to {}", currentVersion, TARGET_VERSION);
            }
        }
    }

    private List<String> buildStatements() {
        List<String> sqls = new ArrayList<>();
        sqls.add("CREATE TABLE IF NOT EXISTS cached_records (" +
                "id BIGSERIAL PRIMARY KEY," +
                "object_id TEXT NOT NULL," +
                "seq INTEGER NOT NULL," +
                "mode TEXT NOT NULL," +
                "slice_dsl TEXT NOT NULL," +
                "query_signature TEXT NOT NULL DEFAULT ''," +
                "window_from DATE NULL," +
                "window_to DATE NULL," +
                "n BIGINT NOT NULL," +
                "k BIGINT NOT NULL," +
                "dates_json TEXT NOT NULL DEFAULT '[]'," +
                "n_daily_json TEXT NOT NULL DEFAULT '[]'," +
                "k_daily_json TEXT NOT NULL DEFAULT '[]'," +
                "retrieved_at TIMESTAMPTZ NULL," +
                "UNIQUE (object_id, seq)" +
                ")");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_cached_records_object ON cached_records(object_id)");
        return sqls;
    }

    private int readSchemaVersion(Connection conn) {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT meta_value FROM run_metadata WHERE meta_key='schema_version'")) {
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    String value = rs.getString(1);
                    if (value != null && value.trim().matches("\\d{1,6}")) {
                        return Integer.parseInt(value.trim());
                    }
                }
            }
        } catch (SQLException e) {
            LOG.warn("schema_version unreadable, assuming 0: {}", e.getMessage());
        }
        return 0;
    }

    private void writeSchemaVersion(Connection conn, int version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO run_metadata(meta_key, meta_value, updated_at) VALUES('schema_version', ?, now()) " +
                        "ON CONFLICT(meta_key) DO UPDATE SET meta_value=excluded.meta_value, updated_at=excluded.updated_at"
        )) {
            ps.setString(1, Integer.toString(version));
            ps.executeUpdate();
        }
    }

    private String summarizeSql(String sql) {
        if (sql == null || sql.trim().isEmpty()) {
            return "-";
        }
        String oneLine = sql.replace('\n', ' ').replace('\r', ' ').replaceAll("\\s+", " ").trim();
        if (oneLine.length() <= 180) {
            return oneLine;
        }
        return oneLine.substring(0, 177) + "...";
    }

    private String safe(String value) {
        return value == null ? "" : value;
    }
}
