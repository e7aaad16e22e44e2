package com.marketdw.etl.health;

/**
 * {@code MAX(unit column)} and {@code COUNT(*)} of one table.
 */
public final class TableStats {
    public final Integer maxUnit;
    public final long rowCount;

    public TableStats(Integer maxUnit, long rowCount) {
        this.maxUnit = maxUnit;
        this.rowCount = rowCount;
    }
}
