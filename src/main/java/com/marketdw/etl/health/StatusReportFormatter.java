package com.marketdw.etl.health;

import java.util.Locale;

/**
 * Plain-text rendering of a pipeline status for terminals and log files.
 */
public final class StatusReportFormatter {
    private static final String RULE = "============================================================";
    private static final String THIN_RULE = "----------------------------------------";

    private StatusReportFormatter() {
    }

    public static String format(PipelineStatus status) {
        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append('\n');
        sb.append("Data Pipeline Status Report\n");
        sb.append(RULE).append('\n');
        sb.append("Expected Trade Date: ").append(status.expectedUnit).append('\n');
        sb.append("Next Trade Date: ").append(status.nextUnit).append('\n');
        sb.append("Overall Status: ").append(status.summary).append('\n');
        for (LayerStatus layer : status.layers) {
            sb.append('\n').append(layer.layer).append(" Layer\n");
            sb.append(THIN_RULE).append('\n');
            sb.append("  Healthy: ").append(flag(layer.healthy)).append('\n');
            sb.append("  Ready for Next: ").append(flag(layer.readyForNext)).append('\n');
            sb.append("  Watermark: ").append(layer.watermark).append('\n');
            sb.append("  Message: ").append(layer.message).append('\n');
            sb.append("  Tables:\n");
            for (TableStatus table : layer.tables) {
                sb.append("    [").append(table.health).append("] ")
                        .append(table.table).append(": ")
                        .append(table.maxUnit)
                        .append(" (").append(String.format(Locale.US, "%,d", table.rowCount)).append(" rows)")
                        .append(table.core ? "" : " optional")
                        .append('\n');
            }
        }
        return sb.toString();
    }

    private static String flag(boolean value) {
        return value ? "yes" : "no";
    }
}
