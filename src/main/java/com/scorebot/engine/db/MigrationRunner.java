package com.scorebot.engine.db;

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
 * Idempotent DDL for the tuning store and the run/result repository.
 */
public final class MigrationRunner {
    private static final Logger LOG = LogManager.getLogger(MigrationRunner.class);
    static final int TARGET_VERSION = 1;

    public void run(Database database) throws SQLException {
        String schema = database.schema();
        try (Connection conn = database.connect(); Statement st = conn.createStatement()) {
            st.execute("CREATE SCHEMA IF NOT EXISTS " + schema);
            st.execute("SET search_path TO " + schema + ", public");
            st.execute("CREATE TABLE IF NOT EXISTS metadata (" +
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
            LOG.info("Migration done schema={} version={}->{}", schema, currentVersion, TARGET_VERSION);
        }
    }

    static List<String> buildStatements() {
        List<String> sqls = new ArrayList<>();
        sqls.add("CREATE TABLE IF NOT EXISTS tuning_parameters (" +
                "id BIGSERIAL PRIMARY KEY," +
                "effective_date DATE NOT NULL," +
                "name TEXT NOT NULL," +
                "value DOUBLE PRECISION NOT NULL," +
                "description TEXT NULL," +
                "created_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "UNIQUE (effective_date, name)" +
                ")");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_tuning_parameters_name_date ON tuning_parameters(name, effective_date DESC)");

        sqls.add("CREATE SEQUENCE IF NOT EXISTS analysis_runs_id_seq");
        sqls.add("CREATE TABLE IF NOT EXISTS analysis_runs (" +
                "id BIGINT PRIMARY KEY," +
                "analyzed_at TIMESTAMPTZ NOT NULL," +
                "parameters_used TEXT NOT NULL" +
                ")");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_analysis_runs_analyzed_at ON analysis_runs(analyzed_at DESC)");

        sqls.add("CREATE TABLE IF NOT EXISTS analysis_results (" +
                "id BIGSERIAL PRIMARY KEY," +
                "run_id BIGINT NOT NULL REFERENCES analysis_runs(id) ON DELETE CASCADE," +
                "ticker TEXT NOT NULL," +
                "price DOUBLE PRECISION NOT NULL," +
                "rsi DOUBLE PRECISION NULL," +
                "deviation_rate DOUBLE PRECISION NULL," +
                "trend TEXT NULL," +
                "macd_line DOUBLE PRECISION NULL," +
                "macd_signal DOUBLE PRECISION NULL," +
                "dmi_plus DOUBLE PRECISION NULL," +
                "dmi_minus DOUBLE PRECISION NULL," +
                "adx DOUBLE PRECISION NULL," +
                "volume DOUBLE PRECISION NULL," +
                "signals_json TEXT NOT NULL," +
                "buy_score INTEGER NOT NULL," +
                "short_score INTEGER NOT NULL," +
                "rationale TEXT NULL," +
                "risk_flag TEXT NULL," +
                "UNIQUE (run_id, ticker)" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS decision_evaluations (" +
                "run_id BIGINT NOT NULL," +
                "ticker TEXT NOT NULL," +
                "evaluated_at TIMESTAMPTZ NOT NULL," +
                "realized_pct DOUBLE PRECISION NOT NULL," +
                "applied_json TEXT NOT NULL," +
                "PRIMARY KEY (run_id, ticker)," +
                "FOREIGN KEY (run_id, ticker) REFERENCES analysis_results(run_id, ticker) ON DELETE CASCADE" +
                ")");
        return sqls;
    }

    private int readSchemaVersion(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT meta_value FROM metadata WHERE meta_key='schema_version'");
             ResultSet rs = ps.executeQuery()) {
            if (rs.next()) {
                String value = rs.getString(1);
                if (value != null && value.trim().matches("\\d+")) {
                    return Integer.parseInt(value.trim());
                }
            }
        }
        return 0;
    }

    private void writeSchemaVersion(Connection conn, int version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO metadata(meta_key, meta_value, updated_at) VALUES('schema_version', ?, now()) " +
                        "ON CONFLICT(meta_key) DO UPDATE SET meta_value=excluded.meta_value, updated_at=excluded.updated_at"
        )) {
            ps.setString(1, Integer.toString(version));
            ps.executeUpdate();
        }
    }

    private static String summarizeSql(String sql) {
        if (sql == null || sql.trim().isEmpty()) {
            return "-";
        }
        String oneLine = sql.replaceAll("\\s+", " ").trim();
        return oneLine.length() <= 180 ? oneLine : oneLine.substring(0, 177) + "...";
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }
}
