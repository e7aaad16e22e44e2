package com.marketdw.etl.health;

import com.marketdw.etl.calendar.UnitSequencer;
import com.marketdw.etl.error.TransformationException;
import com.marketdw.etl.model.WatermarkRecord;
import com.marketdw.etl.store.PipelineStore;
import com.marketdw.etl.store.StoreSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only freshness check of loaded tables against an expected unit.
 * A stale table is a reported status, never an exception.
 */
public final class HealthAuditor {
    private static final Logger LOG = LogManager.getLogger(HealthAuditor.class);

    private final TableStatsSource statsSource;
    private final PipelineStore store;
    private final UnitSequencer sequencer;
    private final List<LayerSpec> layers;

    public HealthAuditor(TableStatsSource statsSource, PipelineStore store, UnitSequencer sequencer, List<LayerSpec> layers) {
        this.statsSource = statsSource;
        this.store = store;
        this.sequencer = sequencer;
        this.layers = List.copyOf(layers);
    }

    public List<LayerSpec> layers() {
        return layers;
    }

    public LayerStatus checkLayer(LayerSpec layer, Integer expectedUnit) throws SQLException {
        List<TableStatus> statuses = new ArrayList<>();
        for (TableSpec table : layer.tables) {
            statuses.add(checkTable(table, expectedUnit));
        }
        Integer watermark = readWatermark(layer.watermarkStream);

        boolean healthy = true;
        List<String> notOk = new ArrayList<>();
        Integer latest = null;
        for (TableStatus status : statuses) {
            if (status.core && status.health != TableHealth.OK) {
                healthy = false;
            }
            if (status.health != TableHealth.OK) {
                notOk.add(status.table);
            }
            if (status.maxUnit != null && (latest == null || status.maxUnit > latest)) {
                latest = status.maxUnit;
            }
        }
        boolean ready = watermark != null && watermark >= (expectedUnit == null ? 0 : expectedUnit);
        String message = healthy
                ? layer.name + " layer healthy, data up to " + expectedUnit
                : layer.name + " layer issues: " + String.join(", ", notOk);
        LOG.info("health layer={} healthy={} ready={} watermark={} expected={}",
                layer.name, healthy, ready, watermark, expectedUnit);
        return new LayerStatus(layer.name, healthy, ready, latest, expectedUnit, watermark, statuses, message);
    }

    /**
     * @param expectedUnit null for the latest open unit on or before today
     */
    public PipelineStatus checkPipeline(Integer expectedUnit) throws SQLException {
        Integer expected = expectedUnit != null ? expectedUnit : sequencer.latestUnit().orElse(null);
        Integer next = expected == null ? null : sequencer.nextUnit(expected).orElse(null);

        List<LayerStatus> statuses = new ArrayList<>();
        boolean allHealthy = true;
        boolean allReady = true;
        List<String> issues = new ArrayList<>();
        for (LayerSpec layer : layers) {
            LayerStatus status = checkLayer(layer, expected);
            statuses.add(status);
            allHealthy &= status.healthy;
            allReady &= status.readyForNext;
            if (!status.healthy) {
                issues.add(status.layer);
            }
        }

        String summary;
        if (allHealthy && allReady) {
            summary = "Pipeline healthy, ready for " + (next == null ? "next day" : next.toString());
        } else if (allHealthy) {
            summary = "Pipeline healthy but watermarks may need update";
        } else {
            summary = "Issues in: " + String.join(", ", issues);
        }
        LOG.info("health pipeline healthy={} ready={} expected={} next={} summary={}",
                allHealthy, allReady, expected, next, summary);
        return new PipelineStatus(allHealthy, allReady, expected, next, statuses, summary);
    }

    TableStatus checkTable(TableSpec table, Integer expectedUnit) {
        TableStats stats;
        try {
            stats = statsSource.stats(table);
        } catch (SQLException | RuntimeException e) {
            LOG.warn("health table check failed table={} err={}", table.table, TransformationException.describe(e));
            return new TableStatus(table.table, null, 0L, expectedUnit, TableHealth.ERROR, table.core,
                    TransformationException.describe(e));
        }
        TableHealth health;
        String message;
        if (stats.rowCount == 0 || stats.maxUnit == null) {
            health = TableHealth.EMPTY;
            message = "Table is empty";
        } else if (expectedUnit == null) {
            health = TableHealth.UNKNOWN;
            message = "No expected date to compare";
        } else if (stats.maxUnit >= expectedUnit) {
            health = TableHealth.OK;
            message = "Data up to date (" + stats.maxUnit + ")";
        } else {
            health = TableHealth.STALE;
            message = "Data stale: " + stats.maxUnit + " < expected " + expectedUnit;
        }
        return new TableStatus(table.table, stats.maxUnit, stats.rowCount, expectedUnit, health, table.core, message);
    }

    private Integer readWatermark(String stream) throws SQLException {
        try (StoreSession session = store.openSession()) {
            Optional<WatermarkRecord> record = session.watermarks().find(stream);
            session.commit();
            return record.map(r -> r.waterMark).orElse(null);
        }
    }
}
