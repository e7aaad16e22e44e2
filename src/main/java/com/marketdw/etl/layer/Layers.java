package com.marketdw.etl.layer;

import com.marketdw.etl.runner.LayerDefinition;
import com.marketdw.etl.source.MarketDataSource;
import com.marketdw.etl.source.RequestStats;

import java.util.Locale;

/**
 * Unit-driven layers by CLI name.
 */
public final class Layers {
    public static final String ODS = "ods";
    public static final String DWD = "dwd";

    private Layers() {
    }

    public static LayerDefinition ods(MarketDataSource source, RequestStats stats) {
        return LayerDefinition.builder()
                .name(ODS)
                .stream("ods_daily")
                .stream("ods_daily_basic")
                .stream("ods_adj_factor")
                .transformation(new OdsDailyLayer(source))
                .rangeCapable(false)
                .requestStats(stats == null ? RequestStats.NONE : stats)
                .build();
    }

    public static LayerDefinition dwd() {
        return LayerDefinition.builder()
                .name(DWD)
                .stream("dwd_daily")
                .stream("dwd_daily_basic")
                .stream("dwd_adj_factor")
                .transformation(new DwdDailyLayer())
                .rangeCapable(true)
                .build();
    }

    public static String normalize(String raw) {
        return raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
    }
}
