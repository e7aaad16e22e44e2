package com.marketdw.etl.layer;

import com.marketdw.etl.calendar.FixedTradeCalendar;
import com.marketdw.etl.calendar.UnitSequencer;
import com.marketdw.etl.error.SourceException;
import com.marketdw.etl.error.TransformationException;
import com.marketdw.etl.model.RunLogRecord;
import com.marketdw.etl.model.RunStatus;
import com.marketdw.etl.model.RunType;
import com.marketdw.etl.model.WatermarkStatus;
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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BaseLayerJobTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-10T09:00:00Z"), ZoneOffset.UTC);

    private final InMemoryPipelineStore store = new InMemoryPipelineStore();
    private final InMemoryRunLedger ledger = new InMemoryRunLedger();
    private final UnitSequencer sequencer = new UnitSequencer(FixedTradeCalendar.weekdays(20231201, 20241231), CLOCK);
    private final FakeSource source = new FakeSource();
    private final BaseLayerJob job = new BaseLayerJob(source, null, store, ledger, sequencer);

    @Test
    void runShouldLoadDimensionsAndSetBothWatermarks() throws Exception {
        int mark = job.run(RunType.INCREMENTAL, 20240102);

        assertEquals(20240110, mark);
        assertEquals(20240110, store.watermark(BaseLayerJob.CALENDAR_STREAM).orElseThrow().waterMark);
        assertEquals(20240110, store.watermark(BaseLayerJob.STOCK_STREAM).orElseThrow().waterMark);
        assertEquals("20240102", source.params.get(0).get("start_date"));
        List<List<Object>> calendar = store.rows("dim_trade_cal");
        assertEquals(2, calendar.size());
        assertEquals(List.of("SSE", 20240102, 1, 20231229), calendar.get(0));
        assertEquals(1, store.rows("dim_stock").size());
        RunLogRecord run = ledger.all().get(0);
        assertEquals(BaseLayerJob.NAME, run.streamName);
        assertEquals(RunStatus.SUCCESS, run.status);
    }

    @Test
    void incrementalRunShouldContinueAfterCalendarWatermark() throws Exception {
        store.seedWatermark(BaseLayerJob.CALENDAR_STREAM, 20240105, WatermarkStatus.SUCCESS);

        job.run(RunType.INCREMENTAL, 20200101);

        assertEquals("20240106", source.params.get(0).get("start_date"));
    }

    @Test
    void incrementalRunShouldStartOnTheCalendarDayAfterAMonthEndWatermark() throws Exception {
        Clock february = Clock.fixed(Instant.parse("2024-02-02T09:00:00Z"), ZoneOffset.UTC);
        BaseLayerJob febJob = new BaseLayerJob(source, null, store, ledger,
                new UnitSequencer(FixedTradeCalendar.weekdays(20231201, 20241231), february));
        store.seedWatermark(BaseLayerJob.CALENDAR_STREAM, 20240131, WatermarkStatus.SUCCESS);

        int mark = febJob.run(RunType.INCREMENTAL, 20200101);

        assertEquals("20240201", source.params.get(0).get("start_date"));
        assertEquals(20240202, mark);
    }

    @Test
    void dimensionsAndWatermarksShouldCommitTogether() throws Exception {
        job.run(RunType.INCREMENTAL, 20240102);

        assertEquals(1, store.commits());
        assertEquals(0, store.rollbacks());
    }

    @Test
    void fullRunShouldReloadFromStartButNeverRegressWatermark() throws Exception {
        store.seedWatermark(BaseLayerJob.CALENDAR_STREAM, 20241231, WatermarkStatus.SUCCESS);

        int mark = job.run(RunType.FULL, 20240102);

        assertEquals("20240102", source.params.get(0).get("start_date"));
        assertEquals(20241231, mark);
        assertEquals(RunType.FULL, ledger.all().get(0).runType);
    }

    @Test
    void upstreamFailureShouldRollBackAndFailTheRun() {
        source.failStocks = true;

        TransformationException error = assertThrows(TransformationException.class,
                () -> job.run(RunType.INCREMENTAL, 20240102));

        assertTrue(error.getCause() instanceof SourceException);
        assertTrue(store.rows("dim_trade_cal").isEmpty());
        assertFalse(store.watermark(BaseLayerJob.CALENDAR_STREAM).isPresent());
        RunLogRecord run = ledger.all().get(0);
        assertEquals(RunStatus.FAILED, run.status);
        assertTrue(run.errMsg.contains("stock_basic unavailable"));
    }

    private static final class FakeSource implements MarketDataSource {
        final List<Map<String, String>> params = new ArrayList<>();
        boolean failStocks;

        @Override
        public SourceFrame fetch(String apiName, Map<String, String> p, String fields) {
            params.add(p);
            if (apiName.equals("trade_cal")) {
                return new SourceFrame(List.of("exchange", "cal_date", "is_open", "pretrade_date"), List.of(
                        List.of("SSE", "20240102", 1, "20231229"),
                        List.of("SSE", "20240106", 0, "20240105")));
            }
            if (failStocks) {
                throw new SourceException(apiName, "stock_basic unavailable");
            }
            return new SourceFrame(List.of("ts_code", "symbol", "name", "list_date"), List.of(
                    List.of("000001.SZ", "000001", "PingAn Bank", "19910403")));
        }
    }
}
