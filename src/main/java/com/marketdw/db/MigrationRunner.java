package com.marketdw.db;

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
 * Idempotent schema setup for control-plane and warehouse tables.
 */
public final class MigrationRunner {
    private static final Logger LOG = LogManager.getLogger(MigrationRunner.class);
    static final int TARGET_VERSION = 1;

    public void run(Database database) throws SQLException {
        String schema = database.schema();
        try (Connection conn = database.connect(); Statement st = conn.createStatement()) {
            st.execute("CREATE SCHEMA IF NOT EXISTS " + schema);
            st.execute("SET search_path TO " + schema + ", public");
            st.execute("CREATE TABLE IF NOT EXISTS meta_schema_version (" +
                    "version INTEGER PRIMARY KEY," +
                    "applied_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                    ")");

            int currentVersion = readSchemaVersion(conn);
            if (currentVersion >= TARGET_VERSION) {
                LOG.info("schema up to date schema={} version={}", schema, currentVersion);
                return;
            }
            String lastSql = "";
            try {
                for (String sql : buildStatements()) {
                    lastSql = sql;
                    st.execute(sql);
                }
                writeSchemaVersion(conn, TARGET_VERSION);
                LOG.info("schema migrated schema={} from={} to={}", schema, currentVersion, TARGET_VERSION);
            } catch (SQLException e) {
                String detail = "migration_failed: schema_version=" + currentVersion
                        + ", target_version=" + TARGET_VERSION
                        + ", failed_sql=" + summarizeSql(lastSql)
                        + ", cause=" + (e.getMessage() == null ? "" : e.getMessage());
                LOG.error(detail);
                throw new SQLException(detail, e.getSQLState(), e.getErrorCode(), e);
            }
        }
    }

    static List<String> buildStatements() {
        List<String> sqls = new ArrayList<>();

        sqls.add("CREATE TABLE IF NOT EXISTS meta_etl_watermark (" +
                "stream_name TEXT PRIMARY KEY," +
                "water_mark INTEGER NOT NULL," +
                "status TEXT NOT NULL," +
                "last_run_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "last_err TEXT NULL" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS meta_etl_run_log (" +
                "id BIGSERIAL PRIMARY KEY," +
                "stream_name TEXT NOT NULL," +
                "run_type TEXT NOT NULL," +
                "start_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "end_at TIMESTAMPTZ NULL," +
                "status TEXT NOT NULL," +
                "err_msg TEXT NULL," +
                "request_count INTEGER NOT NULL DEFAULT 0," +
                "fail_count INTEGER NOT NULL DEFAULT 0" +
                ")");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_run_log_status_start ON meta_etl_run_log(status, start_at)");

        sqls.add("CREATE TABLE IF NOT EXISTS meta_etl_retry_guard (" +
                "id BIGSERIAL PRIMARY KEY," +
                "task_name TEXT NOT NULL," +
                "idempotency_key TEXT NOT NULL," +
                "status TEXT NOT NULL," +
                "attempt INTEGER NOT NULL DEFAULT 0," +
                "started_at TIMESTAMPTZ NULL," +
                "finished_at TIMESTAMPTZ NULL," +
                "timeout_sec INTEGER NOT NULL DEFAULT 0," +
                "err_msg TEXT NULL," +
                "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "UNIQUE (task_name, idempotency_key)" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS dim_trade_cal (" +
                "exchange TEXT NOT NULL," +
                "cal_date INTEGER NOT NULL," +
                "is_open SMALLINT NOT NULL," +
                "pretrade_date INTEGER NULL," +
                "PRIMARY KEY (exchange, cal_date)" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS dim_stock (" +
                "ts_code TEXT PRIMARY KEY," +
                "symbol TEXT NULL," +
                "name TEXT NULL," +
                "area TEXT NULL," +
                "industry TEXT NULL," +
                "market TEXT NULL," +
                "list_date INTEGER NULL," +
                "delist_date INTEGER NULL," +
                "is_hs TEXT NULL" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS ods_daily (" + priceColumns("change") + ")");
        sqls.add("CREATE TABLE IF NOT EXISTS ods_daily_basic (" + basicColumns() + ")");
        sqls.add("CREATE TABLE IF NOT EXISTS ods_adj_factor (" + adjColumns() + ")");
        sqls.add("CREATE TABLE IF NOT EXISTS dwd_daily (" + priceColumns("change_amount") + ")");
        sqls.add("CREATE TABLE IF NOT EXISTS dwd_daily_basic (" + basicColumns() + ")");
        sqls.add("CREATE TABLE IF NOT EXISTS dwd_adj_factor (" + adjColumns() + ")");
        return sqls;
    }

    private static String priceColumns(String changeColumn) {
        return "trade_date INTEGER NOT NULL," +
                "ts_code TEXT NOT NULL," +
                "open NUMERIC NULL," +
                "high NUMERIC NULL," +
                "low NUMERIC NULL," +
                "close NUMERIC NULL," +
                "pre_close NUMERIC NULL," +
                changeColumn + " NUMERIC NULL," +
                "pct_chg NUMERIC NULL," +
                "vol NUMERIC NULL," +
                "amount NUMERIC NULL," +
                "PRIMARY KEY (trade_date, ts_code)";
    }

    private static String basicColumns() {
        return "trade_date INTEGER NOT NULL," +
                "ts_code TEXT NOT NULL," +
                "close NUMERIC NULL," +
                "turnover_rate NUMERIC NULL," +
                "turnover_rate_f NUMERIC NULL," +
                "volume_ratio NUMERIC NULL," +
                "pe NUMERIC NULL," +
                "pe_ttm NUMERIC NULL," +
                "pb NUMERIC NULL," +
                "ps NUMERIC NULL," +
                "ps_ttm NUMERIC NULL," +
                "dv_ratio NUMERIC NULL," +
                "dv_ttm NUMERIC NULL," +
                "total_share NUMERIC NULL," +
                "float_share NUMERIC NULL," +
                "free_share NUMERIC NULL," +
                "total_mv NUMERIC NULL," +
                "circ_mv NUMERIC NULL," +
                "PRIMARY KEY (trade_date, ts_code)";
    }

    private static String adjColumns() {
        return "trade_date INTEGER NOT NULL," +
                "ts_code TEXT NOT NULL," +
                "adj_factor NUMERIC NULL," +
                "PRIMARY KEY (trade_date, ts_code)";
    }

    private int readSchemaVersion(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT COALESCE(MAX(version), 0) FROM meta_schema_version");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    private void writeSchemaVersion(Connection conn, int version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO meta_schema_version(version, applied_at) VALUES(?, now()) ON CONFLICT(version) DO NOTHING")) {
            ps.setInt(1, version);
            ps.executeUpdate();
        }
    }

    private static String summarizeSql(String sql) {
        if (sql == null || sql.trim().isEmpty()) {
            return "-";
        }
        String oneLine = sql.replaceAll("\\s+", " ").trim();
        if (oneLine.length() <= 180) {
            return oneLine;
        }
        return oneLine.substring(0, 177) + "...";
    }
}
