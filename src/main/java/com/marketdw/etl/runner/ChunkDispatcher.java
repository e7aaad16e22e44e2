package com.marketdw.etl.runner;

import com.marketdw.etl.calendar.UnitSequencer;
import com.marketdw.etl.error.ChunkFailureException;
import com.marketdw.etl.error.TransformationException;
import com.marketdw.etl.model.UnitRange;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Chunked backfill: every chunk runs with watermark updates disabled, all chunks are joined, and
 * only then does the parent advance the shared watermark once.
 * <p>
 * With more than one worker each chunk is a separate process; the pool threads only wait on them.
 */
public final class ChunkDispatcher {
    private static final Logger LOG = LogManager.getLogger(ChunkDispatcher.class);

    private final LayerRunner runner;
    private final ChunkLauncher launcher;
    private final UnitSequencer sequencer;

    public ChunkDispatcher(LayerRunner runner, ChunkLauncher launcher, UnitSequencer sequencer) {
        this.runner = runner;
        this.launcher = launcher;
        this.sequencer = sequencer;
    }

    /**
     * @param advanceWatermark false for a dispatcher that is itself a chunk worker
     * @return the watermark after the dispatch, or null when it was not touched
     */
    public Integer dispatch(int start, int end, ChunkGranularity granularity, int workers, boolean advanceWatermark)
            throws SQLException, InterruptedException {
        List<UnitRange> chunks = ChunkPlanner.plan(start, end, granularity);
        String layerName = runner.layer().getName();
        LOG.info("chunked backfill layer={} chunk_by={} workers={} chunks={}",
                layerName, granularity, workers, chunks.size());

        if (workers <= 1) {
            LayerRunner chunkRunner = runner.withWatermarkDisabled();
            for (UnitRange chunk : chunks) {
                LOG.info("chunk start layer={} chunk={}", layerName, chunk);
                chunkRunner.runIncremental(chunk.first, chunk.last);
                LOG.info("chunk done layer={} chunk={}", layerName, chunk);
            }
        } else {
            runInProcesses(layerName, chunks, workers);
        }

        if (!advanceWatermark) {
            return null;
        }
        List<Integer> units = sequencer.listUnits(start, end);
        if (units.isEmpty()) {
            LOG.info("no open units in {}..{}, watermark untouched", start, end);
            return null;
        }
        return runner.advanceWatermark(units.get(units.size() - 1));
    }

    private void runInProcesses(String layerName, List<UnitRange> chunks, int workers) throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(workers, chunks.size()));
        Map<UnitRange, Future<Integer>> futures = new LinkedHashMap<>();
        try {
            for (UnitRange chunk : chunks) {
                futures.put(chunk, pool.submit(() -> launcher.launch(layerName, chunk)));
            }
            List<String> failed = new ArrayList<>();
            Throwable firstCause = null;
            for (Map.Entry<UnitRange, Future<Integer>> entry : futures.entrySet()) {
                try {
                    int exit = entry.getValue().get();
                    if (exit != 0) {
                        failed.add(entry.getKey() + "(exit=" + exit + ")");
                    } else {
                        LOG.info("chunk done layer={} chunk={}", layerName, entry.getKey());
                    }
                } catch (ExecutionException e) {
                    failed.add(entry.getKey() + "(" + TransformationException.describe(e.getCause()) + ")");
                    if (firstCause == null) {
                        firstCause = e.getCause();
                    }
                }
            }
            if (!failed.isEmpty()) {
                LOG.error("chunked backfill failed layer={} failed_chunks={}", layerName, failed);
                throw new ChunkFailureException(layerName, failed, firstCause);
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
