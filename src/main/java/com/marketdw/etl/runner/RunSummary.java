package com.marketdw.etl.runner;

import com.marketdw.etl.model.RunType;

import java.util.Locale;

public final class RunSummary {
    public final String layer;
    public final RunType runType;
    public final long runId;
    public final int unitCount;
    public final Integer firstUnit;
    public final Integer lastUnit;
    public final boolean batched;
    public final Integer watermark;

    public RunSummary(
            String layer,
            RunType runType,
            long runId,
            int unitCount,
            Integer firstUnit,
            Integer lastUnit,
            boolean batched,
            Integer watermark
    ) {
        this.layer = layer;
        this.runType = runType;
        this.runId = runId;
        this.unitCount = unitCount;
        this.firstUnit = firstUnit;
        this.lastUnit = lastUnit;
        this.batched = batched;
        this.watermark = watermark;
    }

    public boolean isNoop() {
        return unitCount == 0;
    }

    @Override
    public String toString() {
        return String.format(
                Locale.US,
                "layer=%s run_type=%s run_id=%d units=%d range=%s..%s batched=%s watermark=%s",
                layer, runType.label(), runId, unitCount, firstUnit, lastUnit, batched, watermark
        );
    }
}
