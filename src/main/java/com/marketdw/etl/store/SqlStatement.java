package com.marketdw.etl.store;

import com.marketdw.etl.model.UnitRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A fixed core query with an optional predicate spliced in at the {@value #FILTER_TOKEN} marker.
 * <p>
 * Parameters are bound in call order, so {@link Builder#bind(Object...)} before {@link Builder#whereUnits}
 * binds placeholders that precede the marker and later calls bind the ones after it.
 */
public final class SqlStatement {
    public static final String FILTER_TOKEN = "{filter}";
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");
    private static final int MAX_SQL_SUMMARY = 160;

    private final String sql;
    private final List<Object> params;

    private SqlStatement(String sql, List<Object> params) {
        this.sql = sql;
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
    }

    public static Builder builder(String coreSql) {
        return new Builder(coreSql);
    }

    public static SqlStatement of(String sql, Object... params) {
        Builder builder = new Builder(sql);
        builder.bind(params);
        return builder.build();
    }

    /**
     * {@code INSERT ... ON CONFLICT (keys) DO UPDATE} for one row; non-key columns are overwritten.
     */
    public static String upsertSql(String table, List<String> columns, List<String> keyColumns) {
        requireIdentifier(table);
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("upsert requires columns: table=" + table);
        }
        if (keyColumns == null || keyColumns.isEmpty()) {
            throw new IllegalArgumentException("upsert requires key columns: table=" + table);
        }
        List<String> updates = new ArrayList<>();
        for (String column : columns) {
            requireIdentifier(column);
            if (!keyColumns.contains(column)) {
                updates.add(column + "=EXCLUDED." + column);
            }
        }
        for (String key : keyColumns) {
            if (!columns.contains(key)) {
                throw new IllegalArgumentException("key column not in column list: " + key);
            }
        }
        String placeholders = String.join(",", Collections.nCopies(columns.size(), "?"));
        String conflict = updates.isEmpty()
                ? "DO NOTHING"
                : "DO UPDATE SET " + String.join(", ", updates);
        return "INSERT INTO " + table + " (" + String.join(",", columns) + ") VALUES (" + placeholders + ") "
                + "ON CONFLICT (" + String.join(",", keyColumns) + ") " + conflict;
    }

    public static String requireIdentifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("invalid sql identifier: " + name);
        }
        return name;
    }

    public String sql() {
        return sql;
    }

    public List<Object> params() {
        return params;
    }

    public String summary() {
        String normalized = sql.replaceAll("\\s+", " ").trim();
        if (normalized.length() <= MAX_SQL_SUMMARY) {
            return normalized;
        }
        return normalized.substring(0, MAX_SQL_SUMMARY) + "...";
    }

    @Override
    public String toString() {
        return summary() + " " + params;
    }

    public static final class Builder {
        private final String coreSql;
        private final List<Object> params = new ArrayList<>();
        private String predicate = "";
        private boolean predicateSet;

        private Builder(String coreSql) {
            this.coreSql = Objects.requireNonNull(coreSql, "coreSql");
        }

        public Builder bind(Object... values) {
            if (values != null) {
                Collections.addAll(params, values);
            }
            return this;
        }

        /**
         * {@code WHERE column = ?} for a single unit, {@code WHERE column BETWEEN ? AND ?} for a range,
         * nothing at all when {@code range} is null.
         */
        public Builder whereUnits(String column, UnitRange range) {
            requireIdentifier(column);
            if (range == null) {
                return where("");
            }
            if (range.isSingle()) {
                return where("WHERE " + column + " = ?", range.first);
            }
            return where("WHERE " + column + " BETWEEN ? AND ?", range.first, range.last);
        }

        public Builder where(String clause, Object... values) {
            if (predicateSet) {
                throw new IllegalStateException("predicate already set");
            }
            if (!coreSql.contains(FILTER_TOKEN)) {
                throw new IllegalStateException("core sql has no " + FILTER_TOKEN + " marker");
            }
            this.predicate = clause == null ? "" : clause;
            this.predicateSet = true;
            return bind(values);
        }

        public SqlStatement build() {
            String sql = coreSql.replace(FILTER_TOKEN, predicate);
            return new SqlStatement(sql, params);
        }
    }
}
