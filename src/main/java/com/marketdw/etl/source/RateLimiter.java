package com.marketdw.etl.source;

import com.marketdw.utils.Sleeper;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Spaces calls at least {@code 60 / maxPerMinute} seconds apart on a monotonic clock.
 * <p>
 * Meant for one sequential caller; use separate instances for endpoints with separate quotas.
 */
public final class RateLimiter {
    private final long intervalNanos;
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;
    private boolean started;
    private long lastNanos;

    public RateLimiter(int maxPerMinute) {
        this(maxPerMinute, System::nanoTime, Sleeper.SYSTEM);
    }

    public RateLimiter(int maxPerMinute, LongSupplier nanoClock, Sleeper sleeper) {
        if (maxPerMinute <= 0) {
            throw new IllegalArgumentException("maxPerMinute must be positive: " + maxPerMinute);
        }
        this.intervalNanos = Duration.ofMinutes(1).toNanos() / maxPerMinute;
        this.nanoClock = nanoClock;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until the interval since the previous return has elapsed. Time the caller already spent counts.
     */
    public void await() throws InterruptedException {
        if (started) {
            long elapsed = nanoClock.getAsLong() - lastNanos;
            long remaining = intervalNanos - elapsed;
            if (remaining > 0L) {
                sleeper.sleep(Duration.ofNanos(remaining));
            }
        }
        lastNanos = nanoClock.getAsLong();
        started = true;
    }

    public Duration interval() {
        return Duration.ofNanos(intervalNanos);
    }
}
