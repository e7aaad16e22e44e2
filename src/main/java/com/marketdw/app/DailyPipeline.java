package com.marketdw.app;

import com.marketdw.etl.health.HealthAuditor;
import com.marketdw.etl.health.PipelineStatus;
import com.marketdw.etl.health.StatusReportFormatter;
import com.marketdw.etl.layer.BaseLayerJob;
import com.marketdw.etl.model.RunType;
import com.marketdw.etl.runner.LayerRunner;
import com.marketdw.etl.runner.RunSummary;
import com.marketdw.utils.StepTimer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;

/**
 * Scheduled end-of-day run: BASE, then ODS, then DWD, then the health audit.
 * A failing layer stops the layers after it.
 */
public final class DailyPipeline {
    private static final Logger LOG = LogManager.getLogger(DailyPipeline.class);

    private final BaseLayerJob base;
    private final LayerRunner ods;
    private final LayerRunner dwd;
    private final HealthAuditor auditor;
    private final int startUnit;

    public DailyPipeline(BaseLayerJob base, LayerRunner ods, LayerRunner dwd, HealthAuditor auditor, int startUnit) {
        this.base = base;
        this.ods = ods;
        this.dwd = dwd;
        this.auditor = auditor;
        this.startUnit = startUnit;
    }

    public PipelineStatus run() throws SQLException {
        StepTimer timer = new StepTimer();
        timer.start("TOTAL");
        try {
            timer.start("BASE");
            base.run(RunType.INCREMENTAL, startUnit);
            timer.end("BASE");

            timer.start("ODS");
            RunSummary odsSummary = ods.runIncremental(null, null);
            timer.end("ODS");

            timer.start("DWD");
            RunSummary dwdSummary = dwd.runIncremental(null, null);
            timer.end("DWD");
            LOG.info("daily layers done ods_units={} dwd_units={}", odsSummary.unitCount, dwdSummary.unitCount);

            timer.start("HEALTH");
            PipelineStatus status = auditor.checkPipeline(null);
            timer.end("HEALTH");
            LOG.info("\n{}", StatusReportFormatter.format(status));
            return status;
        } finally {
            timer.end("TOTAL");
            LOG.info("\n{}", timer.summaryText());
        }
    }
}
