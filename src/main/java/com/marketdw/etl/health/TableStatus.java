package com.marketdw.etl.health;

public final class TableStatus {
    public final String table;
    public final Integer maxUnit;
    public final long rowCount;
    public final Integer expectedUnit;
    public final TableHealth health;
    public final boolean core;
    public final String message;

    public TableStatus(
            String table,
            Integer maxUnit,
            long rowCount,
            Integer expectedUnit,
            TableHealth health,
            boolean core,
            String message
    ) {
        this.table = table;
        this.maxUnit = maxUnit;
        this.rowCount = rowCount;
        this.expectedUnit = expectedUnit;
        this.health = health;
        this.core = core;
        this.message = message;
    }
}
