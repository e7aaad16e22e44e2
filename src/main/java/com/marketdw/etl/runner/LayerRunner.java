package com.marketdw.etl.runner;

import com.marketdw.etl.calendar.TradeDates;
import com.marketdw.etl.calendar.UnitSequencer;
import com.marketdw.etl.error.ConfigurationException;
import com.marketdw.etl.error.TransformationException;
import com.marketdw.etl.model.RunStatus;
import com.marketdw.etl.model.RunType;
import com.marketdw.etl.model.UnitRange;
import com.marketdw.etl.model.WatermarkRecord;
import com.marketdw.etl.model.WatermarkStatus;
import com.marketdw.etl.source.RequestStats;
import com.marketdw.etl.store.PipelineStore;
import com.marketdw.etl.store.RunLedger;
import com.marketdw.etl.store.StoreSession;
import com.marketdw.etl.store.WatermarkStore;
import com.marketdw.utils.TextFormatter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Watermark-driven control loop shared by every layer.
 * <p>
 * Units run strictly in order, each in its own transaction together with the watermark advance.
 * The first failure rolls back, records FAILED against the last good boundary and aborts the
 * rest of the invocation. Every run opens and closes exactly one run-log row.
 */
public final class LayerRunner {
    private static final Logger LOG = LogManager.getLogger(LayerRunner.class);
    static final int MAX_ERROR_CHARS = 2000;

    private final LayerDefinition layer;
    private final PipelineStore store;
    private final RunLedger ledger;
    private final UnitSequencer sequencer;
    private final int batchThreshold;
    private final boolean watermarkEnabled;

    public LayerRunner(
            LayerDefinition layer,
            PipelineStore store,
            RunLedger ledger,
            UnitSequencer sequencer,
            int batchThreshold,
            boolean watermarkEnabled
    ) {
        this.layer = layer;
        this.store = store;
        this.ledger = ledger;
        this.sequencer = sequencer;
        this.batchThreshold = batchThreshold;
        this.watermarkEnabled = watermarkEnabled;
    }

    public LayerDefinition layer() {
        return layer;
    }

    public LayerRunner withWatermarkDisabled() {
        return new LayerRunner(layer, store, ledger, sequencer, batchThreshold, false);
    }

    /**
     * Recomputes {@code [lowerBound, upperBound]} regardless of watermark state. Only an open-ended
     * run (no upper bound) moves the watermark afterwards.
     */
    public RunSummary runFull(int lowerBound, Integer upperBound) throws SQLException {
        long runId = ledger.start(layer.getName(), RunType.FULL);
        Counters before = Counters.of(layer.getRequestStats());
        LOG.info("run start layer={} run_type=full run_id={} lower={} upper={}", layer.getName(), runId, lowerBound, upperBound);
        try (StoreSession session = store.openSession()) {
            Integer stored = readPrimary(session);
            List<Integer> units = sequencer.listUnits(lowerBound, upperBound);
            Cursor cursor = new Cursor(stored, stored, false);
            boolean batched = process(session, units, cursor);

            if (watermarkEnabled && upperBound == null) {
                int target = units.isEmpty() ? TradeDates.previousDay(lowerBound) : units.get(units.size() - 1);
                if (stored == null || target > stored) {
                    saveAll(session.watermarks(), target, WatermarkStatus.SUCCESS, null);
                    cursor.mark = target;
                }
                session.commit();
            }
            RunSummary summary = summary(RunType.FULL, runId, units, batched, cursor.mark);
            closeRun(runId, RunStatus.SUCCESS, null, before);
            LOG.info("run done {}", summary);
            return summary;
        } catch (SQLException | RuntimeException e) {
            closeFailed(runId, e, before);
            throw e;
        }
    }

    /**
     * Processes units after the watermark (or from {@code lowerBound} when given) up to {@code upperBound} or today.
     *
     * @throws ConfigurationException when the stream has no watermark and no lower bound was given
     * @throws TransformationException when a unit or batch failed; remaining units were not attempted
     */
    public RunSummary runIncremental(Integer lowerBound, Integer upperBound) throws SQLException {
        long runId = ledger.start(layer.getName(), RunType.INCREMENTAL);
        Counters before = Counters.of(layer.getRequestStats());
        LOG.info("run start layer={} run_type=incremental run_id={} lower={} upper={}",
                layer.getName(), runId, lowerBound, upperBound);
        try (StoreSession session = store.openSession()) {
            Integer stored = readPrimary(session);
            int firstCandidate;
            Integer boundary;
            if (lowerBound != null) {
                firstCandidate = lowerBound;
                boundary = TradeDates.previousDay(lowerBound);
            } else if (stored != null) {
                firstCandidate = TradeDates.nextDay(stored);
                boundary = stored;
            } else {
                throw new ConfigurationException("missing watermark for stream " + layer.primaryStream()
                        + "; initialize it once (--init-watermark) or pass an explicit start date");
            }
            session.commit();

            List<Integer> units = sequencer.listUnits(firstCandidate, upperBound);
            if (units.isEmpty()) {
                LOG.info("no new units layer={} boundary={}", layer.getName(), boundary);
            }
            Cursor cursor = new Cursor(stored, boundary, watermarkEnabled);
            boolean batched = process(session, units, cursor);

            RunSummary summary = summary(RunType.INCREMENTAL, runId, units, batched, cursor.mark);
            closeRun(runId, RunStatus.SUCCESS, null, before);
            LOG.info("run done {}", summary);
            return summary;
        } catch (SQLException | RuntimeException e) {
            closeFailed(runId, e, before);
            throw e;
        }
    }

    /**
     * Sets every stream of the layer to the day before {@code startUnit}, only where no watermark exists yet.
     */
    public boolean initializeWatermark(int startUnit) throws SQLException {
        int initial = TradeDates.previousDay(startUnit);
        boolean created = false;
        try (StoreSession session = store.openSession()) {
            for (String stream : layer.getStreams()) {
                if (session.watermarks().initialize(stream, initial)) {
                    created = true;
                    LOG.info("watermark initialized stream={} water_mark={}", stream, initial);
                }
            }
            session.commit();
        }
        return created;
    }

    /**
     * Forward-only advance of every stream, used once all chunks of a parallel backfill have joined.
     */
    public Integer advanceWatermark(int unit) throws SQLException {
        try (StoreSession session = store.openSession()) {
            Integer stored = readPrimary(session);
            if (stored != null && stored >= unit) {
                session.commit();
                LOG.info("watermark unchanged stream={} stored={} requested={}", layer.primaryStream(), stored, unit);
                return stored;
            }
            saveAll(session.watermarks(), unit, WatermarkStatus.SUCCESS, null);
            session.commit();
            LOG.info("watermark advanced stream={} from={} to={}", layer.primaryStream(), stored, unit);
            return unit;
        }
    }

    private boolean process(StoreSession session, List<Integer> units, Cursor cursor) {
        if (units.isEmpty()) {
            return false;
        }
        if (layer.isRangeCapable() && batchThreshold > 0 && units.size() > batchThreshold) {
            UnitRange range = UnitRange.of(units.get(0), units.get(units.size() - 1));
            LOG.info("batch mode layer={} range={} units={} threshold={}", layer.getName(), range, units.size(), batchThreshold);
            apply(session, range, cursor);
            return true;
        }
        for (Integer unit : units) {
            apply(session, UnitRange.single(unit), cursor);
        }
        return false;
    }

    private void apply(StoreSession session, UnitRange range, Cursor cursor) {
        try {
            layer.getTransformation().apply(session, range);
            if (cursor.writes && (cursor.mark == null || range.last > cursor.mark)) {
                saveAll(session.watermarks(), range.last, WatermarkStatus.SUCCESS, null);
                cursor.mark = range.last;
            }
            session.commit();
            LOG.info("unit committed layer={} range={} watermark={}", layer.getName(), range, cursor.mark);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            rollbackQuietly(session, e);
            Integer retained = cursor.mark != null ? cursor.mark : cursor.boundary;
            recordFailure(session, cursor, retained, e);
            LOG.error("unit failed layer={} range={} retained_watermark={} cause={}",
                    layer.getName(), range, retained, TransformationException.describe(e));
            throw new TransformationException(layer.primaryStream(), range, retained, e);
        }
    }

    private void recordFailure(StoreSession session, Cursor cursor, Integer retained, Exception cause) {
        if (!watermarkEnabled || retained == null) {
            return;
        }
        if (!cursor.writes && cursor.stored == null) {
            // full run on a stream that was never initialized
            return;
        }
        String err = TextFormatter.head(TransformationException.describe(cause), MAX_ERROR_CHARS);
        try {
            saveAll(session.watermarks(), retained, WatermarkStatus.FAILED, err);
            session.commit();
        } catch (SQLException e) {
            cause.addSuppressed(e);
            rollbackQuietly(session, cause);
        }
    }

    private void saveAll(WatermarkStore watermarks, int mark, WatermarkStatus status, String err) throws SQLException {
        for (String stream : layer.getStreams()) {
            watermarks.save(stream, mark, status, err);
        }
    }

    private Integer readPrimary(StoreSession session) throws SQLException {
        Optional<WatermarkRecord> record = session.watermarks().find(layer.primaryStream());
        return record.map(r -> r.waterMark).orElse(null);
    }

    private void rollbackQuietly(StoreSession session, Exception cause) {
        try {
            session.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    private RunSummary summary(RunType runType, long runId, List<Integer> units, boolean batched, Integer mark) {
        Integer first = units.isEmpty() ? null : units.get(0);
        Integer last = units.isEmpty() ? null : units.get(units.size() - 1);
        return new RunSummary(layer.getName(), runType, runId, units.size(), first, last, batched, mark);
    }

    private void closeRun(long runId, RunStatus status, String err, Counters before) throws SQLException {
        Counters after = Counters.of(layer.getRequestStats());
        ledger.finish(runId, status, err, after.requests - before.requests, after.failures - before.failures);
    }

    private void closeFailed(long runId, Exception cause, Counters before) {
        try {
            closeRun(runId, RunStatus.FAILED, TextFormatter.head(TransformationException.describe(cause), MAX_ERROR_CHARS), before);
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
        LOG.error("run failed layer={} run_id={} cause={}", layer.getName(), runId, TransformationException.describe(cause));
    }

    /**
     * Watermark position while a run is in flight.
     */
    private static final class Cursor {
        final Integer stored;
        final Integer boundary;
        final boolean writes;
        Integer mark;

        Cursor(Integer stored, Integer boundary, boolean writes) {
            this.stored = stored;
            this.boundary = boundary;
            this.writes = writes;
            this.mark = stored;
        }
    }

    private static final class Counters {
        final int requests;
        final int failures;

        private Counters(int requests, int failures) {
            this.requests = requests;
            this.failures = failures;
        }

        static Counters of(RequestStats stats) {
            RequestStats s = stats == null ? RequestStats.NONE : stats;
            return new Counters(s.requestCount(), s.failCount());
        }
    }
}
