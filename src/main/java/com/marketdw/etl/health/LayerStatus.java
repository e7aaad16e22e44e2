package com.marketdw.etl.health;

import java.util.List;

public final class LayerStatus {
    public final String layer;
    public final boolean healthy;
    public final boolean readyForNext;
    public final Integer latestUnit;
    public final Integer expectedUnit;
    public final Integer watermark;
    public final List<TableStatus> tables;
    public final String message;

    public LayerStatus(
            String layer,
            boolean healthy,
            boolean readyForNext,
            Integer latestUnit,
            Integer expectedUnit,
            Integer watermark,
            List<TableStatus> tables,
            String message
    ) {
        this.layer = layer;
        this.healthy = healthy;
        this.readyForNext = readyForNext;
        this.latestUnit = latestUnit;
        this.expectedUnit = expectedUnit;
        this.watermark = watermark;
        this.tables = List.copyOf(tables);
        this.message = message;
    }
}
