package com.marketdw.etl.model;

import java.time.Instant;

public final class RunLogRecord {
    public final long id;
    public final String streamName;
    public final RunType runType;
    public final Instant startAt;
    public final Instant endAt;
    public final RunStatus status;
    public final String errMsg;
    public final int requestCount;
    public final int failCount;

    public RunLogRecord(
            long id,
            String streamName,
            RunType runType,
            Instant startAt,
            Instant endAt,
            RunStatus status,
            String errMsg,
            int requestCount,
            int failCount
    ) {
        this.id = id;
        this.streamName = streamName;
        this.runType = runType;
        this.startAt = startAt;
        this.endAt = endAt;
        this.status = status;
        this.errMsg = errMsg;
        this.requestCount = requestCount;
        this.failCount = failCount;
    }
}
