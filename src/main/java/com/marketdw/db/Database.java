package com.marketdw.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.postgresql.ds.PGSimpleDataSource;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;

/**
 * PostgreSQL connection factory for the warehouse schema.
 */
public final class Database {
    private static final Logger LOG = LogManager.getLogger(Database.class);
    private static final Logger SQL_LOG = LogManager.getLogger("SQL");

    private final DataSource dataSource;
    private final String jdbcUrl;
    private final String schema;
    private final boolean sqlLogEnabled;

    public Database(String jdbcUrl, String user, String pass, String schema, boolean sqlLogEnabled) {
        if (isBlank(jdbcUrl)) {
            throw new IllegalArgumentException("db.url must not be empty");
        }
        this.jdbcUrl = jdbcUrl.trim();
        if (!this.jdbcUrl.toLowerCase(Locale.ROOT).startsWith("jdbc:postgresql:")) {
            throw new IllegalArgumentException("db.url must be a PostgreSQL JDBC URL (jdbc:postgresql://...)");
        }
        this.schema = normalizeSchema(schema);
        this.sqlLogEnabled = sqlLogEnabled;

        PGSimpleDataSource pg = new PGSimpleDataSource();
        pg.setUrl(this.jdbcUrl);
        if (!isBlank(user)) {
            pg.setUser(user.trim());
        }
        if (pass != null) {
            pg.setPassword(pass);
        }
        pg.setCurrentSchema(this.schema);
        pg.setApplicationName("marketdw");
        this.dataSource = pg;
    }

    /**
     * A fresh autocommit connection with the warehouse schema first on the search path.
     */
    public Connection connect() throws SQLException {
        try {
            Connection raw = dataSource.getConnection();
            try (Statement st = raw.createStatement()) {
                st.execute("SET search_path TO " + schema + ", public");
            }
            return sqlLogEnabled ? SqlLogProxy.wrapConnection(raw, SQL_LOG) : raw;
        } catch (SQLException e) {
            String details = "DB connect failed: jdbc_url=" + maskedJdbcUrl()
                    + ", schema=" + schema
                    + ", hint=" + classifyConnectFailure(e)
                    + ", cause=" + safe(e.getMessage());
            LOG.error(details);
            throw new SQLException(details, e.getSQLState(), e.getErrorCode(), e);
        }
    }

    public String schema() {
        return schema;
    }

    public String maskedJdbcUrl() {
        String out = jdbcUrl;
        out = out.replaceAll("(?i)(password=)[^&]+", "$1***");
        out = out.replaceAll("(://[^:/@]+:)[^@]+(@)", "$1***$2");
        return out;
    }

    private static String normalizeSchema(String raw) {
        String value = isBlank(raw) ? "marketdw" : raw.trim();
        if (!value.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            throw new IllegalArgumentException("invalid db.schema, allowed pattern: [A-Za-z_][A-Za-z0-9_]*");
        }
        return value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    static String classifyConnectFailure(SQLException e) {
        String state = e == null ? null : e.getSQLState();
        String msg = safe(e == null ? null : e.getMessage()).toLowerCase(Locale.ROOT);
        if ("28P01".equals(state) || "28000".equals(state) || msg.contains("password authentication failed")) {
            return "auth";
        }
        if ("3D000".equals(state)) {
            return "missing_database";
        }
        if (msg.contains("connection refused") || msg.contains("connect timed out") || (state != null && state.startsWith("08"))) {
            return "unreachable";
        }
        if (msg.contains("permission denied")) {
            return "permission";
        }
        return "connection_error";
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }
}
