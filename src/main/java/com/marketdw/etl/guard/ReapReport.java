package com.marketdw.etl.guard;

import java.util.List;

/**
 * Rows a sweep found stale and, unless dry-run, moved to FAILED.
 */
public final class ReapReport {
    public final boolean dryRun;
    public final int thresholdMinutes;
    public final List<Candidate> runLogRows;
    public final List<Candidate> guardRows;
    public final int updated;

    public ReapReport(boolean dryRun, int thresholdMinutes, List<Candidate> runLogRows, List<Candidate> guardRows, int updated) {
        this.dryRun = dryRun;
        this.thresholdMinutes = thresholdMinutes;
        this.runLogRows = List.copyOf(runLogRows);
        this.guardRows = List.copyOf(guardRows);
        this.updated = updated;
    }

    public int candidateCount() {
        return runLogRows.size() + guardRows.size();
    }

    public static final class Candidate {
        public final long id;
        public final String name;
        public final long ageMinutes;

        public Candidate(long id, String name, long ageMinutes) {
            this.id = id;
            this.name = name;
            this.ageMinutes = ageMinutes;
        }

        @Override
        public String toString() {
            return "id=" + id + " name=" + name + " age_min=" + ageMinutes;
        }
    }
}
