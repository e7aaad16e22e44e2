package com.marketdw.etl.layer;

import com.marketdw.etl.calendar.TradeDates;
import com.marketdw.etl.calendar.UnitSequencer;
import com.marketdw.etl.error.TransformationException;
import com.marketdw.etl.model.RunStatus;
import com.marketdw.etl.model.RunType;
import com.marketdw.etl.model.UnitRange;
import com.marketdw.etl.model.WatermarkRecord;
import com.marketdw.etl.model.WatermarkStatus;
import com.marketdw.etl.source.MarketDataSource;
import com.marketdw.etl.source.RequestStats;
import com.marketdw.etl.source.SourceFrame;
import com.marketdw.etl.store.PipelineStore;
import com.marketdw.etl.store.RunLedger;
import com.marketdw.etl.store.StoreSession;
import com.marketdw.utils.TextFormatter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Loads the trade calendar and the listed-stock dimension. The calendar is what every other layer
 * sequences its units from, so this job cannot itself be driven by units.
 */
public final class BaseLayerJob {
    private static final Logger LOG = LogManager.getLogger(BaseLayerJob.class);

    public static final String NAME = "base";
    public static final String CALENDAR_STREAM = "base_trade_cal";
    public static final String STOCK_STREAM = "base_stock";

    static final List<String> TRADE_CAL_COLUMNS = List.of("exchange", "cal_date", "is_open", "pretrade_date");
    static final List<String> STOCK_COLUMNS = List.of(
            "ts_code", "symbol", "name", "area", "industry", "market", "list_date", "delist_date", "is_hs");

    private final MarketDataSource source;
    private final RequestStats stats;
    private final PipelineStore store;
    private final RunLedger ledger;
    private final UnitSequencer sequencer;

    public BaseLayerJob(MarketDataSource source, RequestStats stats, PipelineStore store, RunLedger ledger, UnitSequencer sequencer) {
        this.source = source;
        this.stats = stats == null ? RequestStats.NONE : stats;
        this.store = store;
        this.ledger = ledger;
        this.sequencer = sequencer;
    }

    /**
     * Full runs reload from {@code startUnit}; incremental runs continue after the calendar watermark,
     * falling back to {@code startUnit} when there is none.
     *
     * @return the calendar watermark after the run
     */
    public int run(RunType runType, int startUnit) throws SQLException {
        long runId = ledger.start(NAME, runType);
        int requestsBefore = stats.requestCount();
        int failuresBefore = stats.failCount();
        LOG.info("run start layer={} run_type={} run_id={} start={}", NAME, runType.label(), runId, startUnit);
        UnitRange window = null;
        try (StoreSession session = store.openSession()) {
            Optional<WatermarkRecord> stored = session.watermarks().find(CALENDAR_STREAM);
            int from = runType == RunType.FULL || stored.isEmpty() ? startUnit : TradeDates.nextDay(stored.get().waterMark);
            window = UnitRange.of(from, Math.max(from, sequencer.today()));
            try {
                Map<String, String> calParams = new LinkedHashMap<>();
                calParams.put("start_date", TradeDates.format(from));
                SourceFrame cal = source.fetch("trade_cal", calParams, String.join(",", TRADE_CAL_COLUMNS));
                int calRows = session.upsertRows("dim_trade_cal", TRADE_CAL_COLUMNS, List.of("exchange", "cal_date"),
                        FrameRows.toRows(cal, TRADE_CAL_COLUMNS, Set.of("cal_date", "pretrade_date")));

                Map<String, String> stockParams = new LinkedHashMap<>();
                stockParams.put("exchange", "");
                stockParams.put("list_status", "L");
                SourceFrame stocks = source.fetch("stock_basic", stockParams, String.join(",", STOCK_COLUMNS));
                int stockRows = session.upsertRows("dim_stock", STOCK_COLUMNS, List.of("ts_code"),
                        FrameRows.toRows(stocks, STOCK_COLUMNS, Set.of("list_date", "delist_date")));
                LOG.info("base loaded from={} trade_cal_rows={} stock_rows={}", from, calRows, stockRows);

                List<Integer> units = sequencer.listUnits(from);
                int latest = units.isEmpty() ? TradeDates.previousDay(from) : units.get(units.size() - 1);
                int mark = stored.map(r -> Math.max(r.waterMark, latest)).orElse(latest);
                session.watermarks().save(CALENDAR_STREAM, mark, WatermarkStatus.SUCCESS, null);
                session.watermarks().save(STOCK_STREAM, mark, WatermarkStatus.SUCCESS, null);
                session.commit();

                ledger.finish(runId, RunStatus.SUCCESS, null,
                        stats.requestCount() - requestsBefore, stats.failCount() - failuresBefore);
                LOG.info("run done layer={} run_id={} watermark={}", NAME, runId, mark);
                return mark;
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                try {
                    session.rollback();
                } catch (SQLException rollbackError) {
                    e.addSuppressed(rollbackError);
                }
                throw new TransformationException(CALENDAR_STREAM, window, stored.map(r -> r.waterMark).orElse(null), e);
            }
        } catch (SQLException | RuntimeException e) {
            String err = TextFormatter.head(TransformationException.describe(e), 2000);
            try {
                ledger.finish(runId, RunStatus.FAILED, err,
                        stats.requestCount() - requestsBefore, stats.failCount() - failuresBefore);
            } catch (SQLException ledgerError) {
                e.addSuppressed(ledgerError);
            }
            LOG.error("run failed layer={} run_id={} window={} cause={}", NAME, runId, window, err);
            throw e;
        }
    }
}
