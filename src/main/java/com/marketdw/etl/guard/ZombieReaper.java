package com.marketdw.etl.guard;

import com.marketdw.etl.model.GuardRecord;
import com.marketdw.etl.model.RunLogRecord;
import com.marketdw.etl.store.GuardStore;
import com.marketdw.etl.store.RunLedger;
import com.marketdw.utils.TextFormatter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Fails RUNNING ledger and guard rows left behind by crashed workers.
 * Prior error text is kept; the cleanup marker is appended to it.
 */
public final class ZombieReaper {
    private static final Logger LOG = LogManager.getLogger(ZombieReaper.class);

    private final RunLedger ledger;
    private final GuardStore guards;
    private final Clock clock;

    public ZombieReaper(RunLedger ledger, GuardStore guards, Clock clock) {
        this.ledger = ledger;
        this.guards = guards;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * @param limit max rows per table, 0 or less for no limit
     */
    public ReapReport sweep(Duration threshold, boolean dryRun, int limit) throws SQLException {
        if (threshold == null || threshold.isNegative() || threshold.isZero()) {
            throw new IllegalArgumentException("threshold must be positive");
        }
        Instant now = clock.instant();
        Instant cutoff = now.minus(threshold);
        int thresholdMinutes = (int) threshold.toMinutes();
        String marker = "[AUTO_CLEANUP " + thresholdMinutes + "m stale RUNNING]";

        List<RunLogRecord> staleRuns = new ArrayList<>();
        for (RunLogRecord run : ledger.listRunning()) {
            if (run.startAt != null && run.startAt.isBefore(cutoff)) {
                staleRuns.add(run);
            }
        }
        staleRuns.sort(Comparator.comparing((RunLogRecord r) -> r.startAt));
        List<GuardRecord> staleGuards = new ArrayList<>();
        for (GuardRecord guard : guards.listRunning()) {
            if (guard.startedAt != null && guard.startedAt.isBefore(cutoff)) {
                staleGuards.add(guard);
            }
        }
        staleGuards.sort(Comparator.comparing((GuardRecord g) -> g.startedAt));
        if (limit > 0) {
            staleRuns = new ArrayList<>(staleRuns.subList(0, Math.min(limit, staleRuns.size())));
            staleGuards = new ArrayList<>(staleGuards.subList(0, Math.min(limit, staleGuards.size())));
        }

        List<ReapReport.Candidate> runCandidates = new ArrayList<>();
        List<ReapReport.Candidate> guardCandidates = new ArrayList<>();
        int updated = 0;
        for (RunLogRecord run : staleRuns) {
            long age = Duration.between(run.startAt, now).toMinutes();
            runCandidates.add(new ReapReport.Candidate(run.id, run.streamName, age));
            if (!dryRun) {
                updated += ledger.markAbandoned(run.id, TextFormatter.appendNote(run.errMsg, marker), now);
            }
        }
        for (GuardRecord guard : staleGuards) {
            long age = Duration.between(guard.startedAt, now).toMinutes();
            guardCandidates.add(new ReapReport.Candidate(guard.id, guard.taskName + "/" + guard.idempotencyKey, age));
            if (!dryRun) {
                updated += guards.markAbandoned(guard.id, TextFormatter.appendNote(guard.errMsg, marker), now);
            }
        }
        ReapReport report = new ReapReport(dryRun, thresholdMinutes, runCandidates, guardCandidates, updated);
        LOG.info("zombie sweep dry_run={} threshold_min={} run_log_candidates={} guard_candidates={} updated={}",
                dryRun, thresholdMinutes, runCandidates.size(), guardCandidates.size(), updated);
        return report;
    }
}
