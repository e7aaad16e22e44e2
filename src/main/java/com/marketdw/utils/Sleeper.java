package com.marketdw.utils;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = duration -> {
        long ms = ceilMillis(duration);
        if (ms > 0L) {
            Thread.sleep(ms);
        }
    };

    void sleep(Duration duration) throws InterruptedException;

    /**
     * Whole milliseconds covering {@code duration}; a partial millisecond counts as one.
     */
    static long ceilMillis(Duration duration) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            return 0L;
        }
        long ms = duration.toMillis();
        return duration.toNanosPart() % 1_000_000 == 0 ? ms : ms + 1;
    }
}
