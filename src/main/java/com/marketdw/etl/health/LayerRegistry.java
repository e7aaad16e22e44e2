package com.marketdw.etl.health;

import java.util.List;

/**
 * Audited layers in pipeline order.
 */
public final class LayerRegistry {
    private LayerRegistry() {
    }

    public static List<LayerSpec> defaults() {
        return List.of(
                new LayerSpec("BASE", "base_trade_cal", List.of(
                        new TableSpec("dim_trade_cal", "cal_date", true),
                        new TableSpec("dim_stock", "list_date", false))),
                new LayerSpec("ODS", "ods_daily", List.of(
                        TableSpec.core("ods_daily"),
                        TableSpec.core("ods_daily_basic"),
                        TableSpec.core("ods_adj_factor"))),
                new LayerSpec("DWD", "dwd_daily", List.of(
                        TableSpec.core("dwd_daily"),
                        TableSpec.core("dwd_daily_basic"),
                        TableSpec.core("dwd_adj_factor")))
        );
    }
}
