package com.marketdw.etl.layer;

import com.marketdw.etl.calendar.TradeDates;
import com.marketdw.etl.model.UnitRange;
import com.marketdw.etl.runner.UnitTransformation;
import com.marketdw.etl.source.MarketDataSource;
import com.marketdw.etl.source.SourceFrame;
import com.marketdw.etl.store.StoreSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Raw daily market tables, one upstream call per table per trade date.
 */
public final class OdsDailyLayer implements UnitTransformation {
    private static final Logger LOG = LogManager.getLogger(OdsDailyLayer.class);

    static final List<String> KEY = List.of("trade_date", "ts_code");
    static final List<String> DAILY_COLUMNS = List.of(
            "trade_date", "ts_code", "open", "high", "low", "close", "pre_close", "change", "pct_chg", "vol", "amount");
    static final List<String> DAILY_BASIC_COLUMNS = List.of(
            "trade_date", "ts_code", "close", "turnover_rate", "turnover_rate_f", "volume_ratio",
            "pe", "pe_ttm", "pb", "ps", "ps_ttm", "dv_ratio", "dv_ttm",
            "total_share", "float_share", "free_share", "total_mv", "circ_mv");
    static final List<String> ADJ_FACTOR_COLUMNS = List.of("trade_date", "ts_code", "adj_factor");
    private static final Set<String> DATE_COLUMNS = Set.of("trade_date");

    private final MarketDataSource source;

    public OdsDailyLayer(MarketDataSource source) {
        this.source = source;
    }

    @Override
    public void apply(StoreSession session, UnitRange range) throws Exception {
        if (!range.isSingle()) {
            throw new IllegalArgumentException("ods loads one trade date at a time, got " + range);
        }
        String tradeDate = TradeDates.format(range.first);
        Map<String, String> params = Map.of("trade_date", tradeDate);

        int daily = load(session, "daily", "ods_daily", DAILY_COLUMNS, params);
        int basic = load(session, "daily_basic", "ods_daily_basic", DAILY_BASIC_COLUMNS, params);
        int adj = load(session, "adj_factor", "ods_adj_factor", ADJ_FACTOR_COLUMNS, params);
        LOG.info("ods loaded trade_date={} daily={} daily_basic={} adj_factor={}", tradeDate, daily, basic, adj);
    }

    private int load(StoreSession session, String apiName, String table, List<String> columns, Map<String, String> params)
            throws Exception {
        SourceFrame frame = source.fetch(apiName, params, String.join(",", columns));
        if (frame.isEmpty()) {
            LOG.warn("ods empty response api={} params={}", apiName, params);
            return 0;
        }
        return session.upsertRows(table, columns, KEY, FrameRows.toRows(frame, columns, DATE_COLUMNS));
    }
}
