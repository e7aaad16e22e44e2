package com.marketdw.etl.runner;

import com.marketdw.etl.calendar.FixedTradeCalendar;
import com.marketdw.etl.calendar.UnitSequencer;
import com.marketdw.etl.error.ChunkFailureException;
import com.marketdw.etl.model.UnitRange;
import com.marketdw.etl.model.WatermarkStatus;
import com.marketdw.etl.store.InMemoryPipelineStore;
import com.marketdw.etl.store.InMemoryRunLedger;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChunkDispatcherTest {
    private static final String STREAM = "dwd_daily";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T04:00:00Z"), ZoneOffset.UTC);

    private final InMemoryPipelineStore store = new InMemoryPipelineStore();
    private final InMemoryRunLedger ledger = new InMemoryRunLedger();
    private final UnitSequencer sequencer = new UnitSequencer(FixedTradeCalendar.weekdays(20231201, 20240331), CLOCK);
    private final List<UnitRange> applied = Collections.synchronizedList(new ArrayList<>());

    @Test
    void sequentialChunksShouldAdvanceWatermarkOnceAfterAllChunks() throws Exception {
        store.seedWatermark(STREAM, 20231229, WatermarkStatus.SUCCESS);
        ChunkDispatcher dispatcher = new ChunkDispatcher(runner(), unusedLauncher(), sequencer);

        Integer mark = dispatcher.dispatch(20240101, 20240229, ChunkGranularity.MONTH, 1, true);

        assertEquals(20240229, mark);
        assertEquals(20240229, store.watermark(STREAM).orElseThrow().waterMark);
        assertEquals(44, applied.size());
        // one run-log row per chunk
        assertEquals(2, ledger.all().size());
    }

    @Test
    void workerModeShouldLeaveWatermarkAlone() throws Exception {
        store.seedWatermark(STREAM, 20231229, WatermarkStatus.SUCCESS);
        ChunkDispatcher dispatcher = new ChunkDispatcher(runner(), unusedLauncher(), sequencer);

        assertNull(dispatcher.dispatch(20240101, 20240131, ChunkGranularity.NONE, 1, false));

        assertEquals(20231229, store.watermark(STREAM).orElseThrow().waterMark);
    }

    @Test
    void parallelChunksShouldLaunchOneWorkerPerChunk() throws Exception {
        store.seedWatermark(STREAM, 20221230, WatermarkStatus.SUCCESS);
        RecordingLauncher launcher = new RecordingLauncher(Set.of());
        ChunkDispatcher dispatcher = new ChunkDispatcher(runner(), launcher, sequencer);

        Integer mark = dispatcher.dispatch(20230101, 20240110, ChunkGranularity.YEAR, 4, true);

        assertEquals(Set.of(UnitRange.of(20230101, 20231231), UnitRange.of(20240101, 20240110)), Set.copyOf(launcher.launched));
        assertTrue(applied.isEmpty());
        assertEquals(20240110, mark);
        assertEquals(20240110, store.watermark(STREAM).orElseThrow().waterMark);
    }

    @Test
    void anyFailedChunkShouldAbortWithoutAdvancing() {
        store.seedWatermark(STREAM, 20221230, WatermarkStatus.SUCCESS);
        RecordingLauncher launcher = new RecordingLauncher(Set.of(UnitRange.of(20230101, 20231231)));
        ChunkDispatcher dispatcher = new ChunkDispatcher(runner(), launcher, sequencer);

        ChunkFailureException error = assertThrows(ChunkFailureException.class,
                () -> dispatcher.dispatch(20230101, 20240110, ChunkGranularity.YEAR, 2, true));

        assertEquals("dwd", error.layerName());
        assertEquals(List.of("20230101-20231231(exit=1)"), error.failedChunks());
        assertEquals(2, launcher.launched.size());
        assertEquals(20221230, store.watermark(STREAM).orElseThrow().waterMark);
    }

    @Test
    void rangeWithoutOpenUnitsShouldNotAdvance() throws Exception {
        store.seedWatermark(STREAM, 20240105, WatermarkStatus.SUCCESS);
        ChunkDispatcher dispatcher = new ChunkDispatcher(runner(), unusedLauncher(), sequencer);

        assertNull(dispatcher.dispatch(20240106, 20240107, ChunkGranularity.NONE, 1, true));

        assertEquals(20240105, store.watermark(STREAM).orElseThrow().waterMark);
    }

    private LayerRunner runner() {
        LayerDefinition layer = LayerDefinition.builder()
                .name("dwd")
                .stream(STREAM)
                .transformation((session, range) -> applied.add(range))
                .build();
        return new LayerRunner(layer, store, ledger, sequencer, 0, true);
    }

    private static ChunkLauncher unusedLauncher() {
        return (layerName, chunk) -> {
            throw new AssertionError("no worker process expected");
        };
    }

    private static final class RecordingLauncher implements ChunkLauncher {
        final List<UnitRange> launched = Collections.synchronizedList(new ArrayList<>());
        private final Set<UnitRange> failing;

        RecordingLauncher(Set<UnitRange> failing) {
            this.failing = failing;
        }

        @Override
        public int launch(String layerName, UnitRange chunk) {
            launched.add(chunk);
            return failing.contains(chunk) ? 1 : 0;
        }
    }
}
