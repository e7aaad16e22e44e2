package com.marketdw.etl.guard;

public final class GuardOutcome {
    public enum Kind {
        SKIPPED,
        SUCCEEDED,
        FAILED
    }

    public final String taskName;
    public final String idempotencyKey;
    public final Kind kind;
    public final int attempts;
    public final String lastError;

    public GuardOutcome(String taskName, String idempotencyKey, Kind kind, int attempts, String lastError) {
        this.taskName = taskName;
        this.idempotencyKey = idempotencyKey;
        this.kind = kind;
        this.attempts = attempts;
        this.lastError = lastError;
    }

    public boolean ok() {
        return kind != Kind.FAILED;
    }

    @Override
    public String toString() {
        return "task=" + taskName + " key=" + idempotencyKey + " outcome=" + kind + " attempts=" + attempts;
    }
}
