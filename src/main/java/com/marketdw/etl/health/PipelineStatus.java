package com.marketdw.etl.health;

import java.util.List;

public final class PipelineStatus {
    public final boolean healthy;
    public final boolean readyForNext;
    public final Integer expectedUnit;
    public final Integer nextUnit;
    public final List<LayerStatus> layers;
    public final String summary;

    public PipelineStatus(
            boolean healthy,
            boolean readyForNext,
            Integer expectedUnit,
            Integer nextUnit,
            List<LayerStatus> layers,
            String summary
    ) {
        this.healthy = healthy;
        this.readyForNext = readyForNext;
        this.expectedUnit = expectedUnit;
        this.nextUnit = nextUnit;
        this.layers = List.copyOf(layers);
        this.summary = summary;
    }
}
