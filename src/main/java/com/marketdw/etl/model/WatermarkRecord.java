package com.marketdw.etl.model;

import java.time.Instant;

/**
 * Last successfully processed unit of a named progress stream.
 */
public final class WatermarkRecord {
    public final String streamName;
    public final int waterMark;
    public final WatermarkStatus status;
    public final Instant lastRunAt;
    public final String lastErr;

    public WatermarkRecord(
            String streamName,
            int waterMark,
            WatermarkStatus status,
            Instant lastRunAt,
            String lastErr
    ) {
        this.streamName = streamName;
        this.waterMark = waterMark;
        this.status = status;
        this.lastRunAt = lastRunAt;
        this.lastErr = lastErr;
    }

    public boolean failed() {
        return status == WatermarkStatus.FAILED;
    }

    @Override
    public String toString() {
        return streamName + "@" + waterMark + "(" + status + ")";
    }
}
