package com.marketdw.etl.runner;

import com.marketdw.etl.source.RequestStats;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One pipeline stage: its run-log name, the watermark streams it advances and the work per unit.
 * The first stream is the primary one; the start boundary of incremental runs is read from it.
 */
@Value
@Builder
public class LayerDefinition {
    String name;
    @Singular
    List<String> streams;
    UnitTransformation transformation;
    /**
     * Whether {@link #transformation} accepts multi-unit ranges, enabling batch mode.
     */
    boolean rangeCapable;
    @Builder.Default
    RequestStats requestStats = RequestStats.NONE;

    public String primaryStream() {
        if (streams == null || streams.isEmpty()) {
            throw new IllegalStateException("layer " + name + " declares no watermark streams");
        }
        return streams.get(0);
    }
}
