package com.marketdw.etl.health;

import com.marketdw.etl.store.SqlStatement;

/**
 * A table audited for freshness. Only core tables decide whether a layer is healthy.
 */
public final class TableSpec {
    public final String table;
    public final String unitColumn;
    public final boolean core;

    public TableSpec(String table, String unitColumn, boolean core) {
        this.table = SqlStatement.requireIdentifier(table);
        this.unitColumn = SqlStatement.requireIdentifier(unitColumn);
        this.core = core;
    }

    public static TableSpec core(String table) {
        return new TableSpec(table, "trade_date", true);
    }

    public static TableSpec optional(String table) {
        return new TableSpec(table, "trade_date", false);
    }
}
