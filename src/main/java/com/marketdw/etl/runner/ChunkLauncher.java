package com.marketdw.etl.runner;

import com.marketdw.etl.model.UnitRange;

import java.io.IOException;

/**
 * Runs one backfill chunk in its own process with watermark updates disabled.
 */
public interface ChunkLauncher {

    /**
     * @return the worker's exit code, 0 on success
     */
    int launch(String layerName, UnitRange chunk) throws IOException, InterruptedException;
}
