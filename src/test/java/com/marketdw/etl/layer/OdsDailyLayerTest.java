package com.marketdw.etl.layer;

import com.marketdw.etl.model.UnitRange;
import com.marketdw.etl.source.MarketDataSource;
import com.marketdw.etl.source.SourceFrame;
import com.marketdw.etl.store.InMemoryPipelineStore;
import com.marketdw.etl.store.StoreSession;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OdsDailyLayerTest {
    private final InMemoryPipelineStore store = new InMemoryPipelineStore();
    private final FakeSource source = new FakeSource();

    @Test
    void applyShouldFetchEachApiForTheTradeDate() throws Exception {
        source.frames.put("daily", new SourceFrame(
                List.of("ts_code", "trade_date", "close", "vol"),
                List.of(List.of("000001.SZ", "20240105", 9.21, 1000.0), List.of("600000.SH", "20240105", 7.1, 800.0))));
        source.frames.put("adj_factor", new SourceFrame(
                List.of("ts_code", "trade_date", "adj_factor"),
                List.of(List.of("000001.SZ", "20240105", 108.031))));

        applyAndCommit(UnitRange.single(20240105));

        assertEquals(List.of("daily", "daily_basic", "adj_factor"), source.apis);
        assertTrue(source.params.stream().allMatch(p -> p.equals(Map.of("trade_date", "20240105"))));
        List<List<Object>> daily = store.rows("ods_daily");
        assertEquals(2, daily.size());
        List<Object> first = daily.get(0);
        assertEquals(20240105, first.get(0));
        assertEquals("000001.SZ", first.get(1));
        assertEquals(9.21, first.get(OdsDailyLayer.DAILY_COLUMNS.indexOf("close")));
        assertNull(first.get(OdsDailyLayer.DAILY_COLUMNS.indexOf("open")));
        assertTrue(store.rows("ods_daily_basic").isEmpty());
        assertEquals(1, store.rows("ods_adj_factor").size());
    }

    @Test
    void replayingTheSameDateShouldOverwriteRows() throws Exception {
        source.frames.put("daily", new SourceFrame(
                List.of("ts_code", "trade_date", "close"),
                List.of(List.of("000001.SZ", "20240105", 9.21))));
        applyAndCommit(UnitRange.single(20240105));
        source.frames.put("daily", new SourceFrame(
                List.of("ts_code", "trade_date", "close"),
                List.of(List.of("000001.SZ", "20240105", 9.30))));
        applyAndCommit(UnitRange.single(20240105));

        List<List<Object>> daily = store.rows("ods_daily");
        assertEquals(1, daily.size());
        assertEquals(9.30, daily.get(0).get(OdsDailyLayer.DAILY_COLUMNS.indexOf("close")));
    }

    @Test
    void rangesShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> applyAndCommit(UnitRange.of(20240104, 20240105)));
    }

    private void applyAndCommit(UnitRange range) throws Exception {
        try (StoreSession session = store.openSession()) {
            new OdsDailyLayer(source).apply(session, range);
            session.commit();
        }
    }

    private static final class FakeSource implements MarketDataSource {
        final Map<String, SourceFrame> frames = new HashMap<>();
        final List<String> apis = new ArrayList<>();
        final List<Map<String, String>> params = new ArrayList<>();

        @Override
        public SourceFrame fetch(String apiName, Map<String, String> p, String fields) {
            apis.add(apiName);
            params.add(p);
            return frames.getOrDefault(apiName, SourceFrame.empty());
        }
    }
}
