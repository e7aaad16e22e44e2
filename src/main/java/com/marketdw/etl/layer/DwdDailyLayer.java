package com.marketdw.etl.layer;

import com.marketdw.etl.model.UnitRange;
import com.marketdw.etl.runner.UnitTransformation;
import com.marketdw.etl.store.SqlStatement;
import com.marketdw.etl.store.StoreSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.math.BigDecimal;

/**
 * Standardized daily tables rebuilt from ODS for one trade date or a whole range.
 * Valuation ratios outside the storable range are nulled.
 */
public final class DwdDailyLayer implements UnitTransformation {
    private static final Logger LOG = LogManager.getLogger(DwdDailyLayer.class);

    static final BigDecimal MAX_RATIO = new BigDecimal("999999.999999");

    static final String DAILY_SQL = "INSERT INTO dwd_daily (trade_date, ts_code, open, high, low, close, pre_close, "
            + "change_amount, pct_chg, vol, amount) "
            + "SELECT trade_date, ts_code, open, high, low, close, pre_close, change, pct_chg, vol, amount "
            + "FROM ods_daily {filter} "
            + "ON CONFLICT (trade_date, ts_code) DO UPDATE SET "
            + "open=EXCLUDED.open, high=EXCLUDED.high, low=EXCLUDED.low, close=EXCLUDED.close, "
            + "pre_close=EXCLUDED.pre_close, change_amount=EXCLUDED.change_amount, "
            + "pct_chg=EXCLUDED.pct_chg, vol=EXCLUDED.vol, amount=EXCLUDED.amount";

    static final String DAILY_BASIC_SQL = "INSERT INTO dwd_daily_basic (trade_date, ts_code, close, turnover_rate, "
            + "turnover_rate_f, volume_ratio, pe, pe_ttm, pb, ps, ps_ttm, dv_ratio, dv_ttm, total_share, "
            + "float_share, free_share, total_mv, circ_mv) "
            + "SELECT trade_date, ts_code, close, turnover_rate, turnover_rate_f, volume_ratio, "
            + bounded("pe") + ", " + bounded("pe_ttm") + ", " + bounded("pb") + ", "
            + bounded("ps") + ", " + bounded("ps_ttm") + ", "
            + "dv_ratio, dv_ttm, total_share, float_share, free_share, total_mv, circ_mv "
            + "FROM ods_daily_basic {filter} "
            + "ON CONFLICT (trade_date, ts_code) DO UPDATE SET "
            + "close=EXCLUDED.close, turnover_rate=EXCLUDED.turnover_rate, turnover_rate_f=EXCLUDED.turnover_rate_f, "
            + "volume_ratio=EXCLUDED.volume_ratio, pe=EXCLUDED.pe, pe_ttm=EXCLUDED.pe_ttm, pb=EXCLUDED.pb, "
            + "ps=EXCLUDED.ps, ps_ttm=EXCLUDED.ps_ttm, dv_ratio=EXCLUDED.dv_ratio, dv_ttm=EXCLUDED.dv_ttm, "
            + "total_share=EXCLUDED.total_share, float_share=EXCLUDED.float_share, free_share=EXCLUDED.free_share, "
            + "total_mv=EXCLUDED.total_mv, circ_mv=EXCLUDED.circ_mv";

    static final String ADJ_FACTOR_SQL = "INSERT INTO dwd_adj_factor (trade_date, ts_code, adj_factor) "
            + "SELECT trade_date, ts_code, adj_factor FROM ods_adj_factor {filter} "
            + "ON CONFLICT (trade_date, ts_code) DO UPDATE SET adj_factor=EXCLUDED.adj_factor";

    private static final int BOUNDED_RATIOS = 5;

    private static String bounded(String column) {
        return "CASE WHEN " + column + " IS NULL OR " + column + " BETWEEN -CAST(? AS NUMERIC) AND CAST(? AS NUMERIC) "
                + "THEN " + column + " ELSE NULL END AS " + column;
    }

    @Override
    public void apply(StoreSession session, UnitRange range) throws Exception {
        int daily = session.execute(dailyStatement(range));
        int basic = session.execute(dailyBasicStatement(range));
        int adj = session.execute(adjFactorStatement(range));
        LOG.info("dwd loaded range={} daily={} daily_basic={} adj_factor={}", range, daily, basic, adj);
    }

    static SqlStatement dailyStatement(UnitRange range) {
        return SqlStatement.builder(DAILY_SQL).whereUnits("trade_date", range).build();
    }

    static SqlStatement dailyBasicStatement(UnitRange range) {
        SqlStatement.Builder builder = SqlStatement.builder(DAILY_BASIC_SQL);
        for (int i = 0; i < BOUNDED_RATIOS; i++) {
            builder.bind(MAX_RATIO, MAX_RATIO);
        }
        return builder.whereUnits("trade_date", range).build();
    }

    static SqlStatement adjFactorStatement(UnitRange range) {
        return SqlStatement.builder(ADJ_FACTOR_SQL).whereUnits("trade_date", range).build();
    }
}
