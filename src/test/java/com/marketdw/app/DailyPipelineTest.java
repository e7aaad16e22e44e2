package com.marketdw.app;

import com.marketdw.etl.calendar.FixedTradeCalendar;
import com.marketdw.etl.calendar.UnitSequencer;
import com.marketdw.etl.error.ConfigurationException;
import com.marketdw.etl.health.HealthAuditor;
import com.marketdw.etl.health.LayerRegistry;
import com.marketdw.etl.health.PipelineStatus;
import com.marketdw.etl.health.TableStats;
import com.marketdw.etl.layer.BaseLayerJob;
import com.marketdw.etl.layer.Layers;
import com.marketdw.etl.model.RunLogRecord;
import com.marketdw.etl.model.WatermarkStatus;
import com.marketdw.etl.runner.LayerRunner;
import com.marketdw.etl.source.MarketDataSource;
import com.marketdw.etl.source.SourceFrame;
import com.marketdw.etl.store.InMemoryPipelineStore;
import com.marketdw.etl.store.InMemoryRunLedger;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DailyPipelineTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-10T10:00:00Z"), ZoneOffset.UTC);

    private final InMemoryPipelineStore store = new InMemoryPipelineStore();
    private final InMemoryRunLedger ledger = new InMemoryRunLedger();
    private final UnitSequencer sequencer = new UnitSequencer(FixedTradeCalendar.weekdays(20231201, 20240131), CLOCK);
    private final FakeSource source = new FakeSource();

    @Test
    void dailyRunShouldCatchUpEveryLayerAndReportHealthy() throws Exception {
        seedLayerWatermarks(20240108);

        PipelineStatus status = pipeline().run();

        assertTrue(status.healthy);
        assertEquals("Pipeline healthy, ready for 20240111", status.summary);
        assertEquals(20240110, store.watermark("ods_daily").orElseThrow().waterMark);
        assertEquals(20240110, store.watermark("ods_adj_factor").orElseThrow().waterMark);
        assertEquals(20240110, store.watermark("dwd_daily").orElseThrow().waterMark);
        assertEquals(20240110, store.watermark(BaseLayerJob.CALENDAR_STREAM).orElseThrow().waterMark);
        List<String> layers = new ArrayList<>();
        for (RunLogRecord run : ledger.all()) {
            layers.add(run.streamName);
        }
        assertEquals(List.of("base", "ods", "dwd"), layers);
    }

    @Test
    void failingLayerShouldStopLaterLayers() {
        // ods was never initialized
        store.seedWatermark("dwd_daily", 20240108, WatermarkStatus.SUCCESS);

        assertThrows(ConfigurationException.class, () -> pipeline().run());

        List<RunLogRecord> runs = ledger.all();
        assertEquals(2, runs.size());
        assertEquals("ods", runs.get(1).streamName);
        assertEquals(20240108, store.watermark("dwd_daily").orElseThrow().waterMark);
    }

    private DailyPipeline pipeline() {
        BaseLayerJob base = new BaseLayerJob(source, null, store, ledger, sequencer);
        LayerRunner ods = new LayerRunner(Layers.ods(source, null), store, ledger, sequencer, 0, true);
        LayerRunner dwd = new LayerRunner(Layers.dwd(), store, ledger, sequencer, 30, true);
        HealthAuditor auditor = new HealthAuditor(table -> new TableStats(20240110, 100L), store, sequencer,
                LayerRegistry.defaults());
        return new DailyPipeline(base, ods, dwd, auditor, 20240102);
    }

    private void seedLayerWatermarks(int mark) {
        for (String stream : List.of("ods_daily", "ods_daily_basic", "ods_adj_factor",
                "dwd_daily", "dwd_daily_basic", "dwd_adj_factor")) {
            store.seedWatermark(stream, mark, WatermarkStatus.SUCCESS);
        }
    }

    private static final class FakeSource implements MarketDataSource {

        @Override
        public SourceFrame fetch(String apiName, Map<String, String> params, String fields) {
            String date = params.getOrDefault("trade_date", "20240102");
            return new SourceFrame(List.of("ts_code", "trade_date", "exchange", "cal_date", "is_open"),
                    List.of(List.of("000001.SZ", date, "SSE", date, 1)));
        }
    }
}
