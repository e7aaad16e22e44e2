package com.marketdw.etl.model;

import java.time.Instant;

/**
 * Attempt state of one (task name, idempotency key) pair.
 */
public final class GuardRecord {
    public final long id;
    public final String taskName;
    public final String idempotencyKey;
    public final RunStatus status;
    public final int attempt;
    public final Instant startedAt;
    public final Instant finishedAt;
    public final int timeoutSec;
    public final String errMsg;

    public GuardRecord(
            long id,
            String taskName,
            String idempotencyKey,
            RunStatus status,
            int attempt,
            Instant startedAt,
            Instant finishedAt,
            int timeoutSec,
            String errMsg
    ) {
        this.id = id;
        this.taskName = taskName;
        this.idempotencyKey = idempotencyKey;
        this.status = status;
        this.attempt = attempt;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
        this.timeoutSec = timeoutSec;
        this.errMsg = errMsg;
    }
}
