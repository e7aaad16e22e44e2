package com.marketdw.etl.source;

import com.marketdw.etl.error.TransientSourceException;
import com.marketdw.utils.Sleeper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Rate-limited fetches with exponential backoff on transient failures only.
 */
public final class RetryingSource implements MarketDataSource, RequestStats {
    private static final Logger LOG = LogManager.getLogger(RetryingSource.class);

    private final MarketDataSource delegate;
    private final RateLimiter limiter;
    private final int maxAttempts;
    private final long backoffBaseMs;
    private final Sleeper sleeper;
    private final AtomicInteger requests = new AtomicInteger(0);
    private final AtomicInteger failures = new AtomicInteger(0);

    public RetryingSource(MarketDataSource delegate, RateLimiter limiter, int maxAttempts, long backoffBaseMs, Sleeper sleeper) {
        this.delegate = delegate;
        this.limiter = limiter;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoffBaseMs = Math.max(0L, backoffBaseMs);
        this.sleeper = sleeper;
    }

    @Override
    public SourceFrame fetch(String apiName, Map<String, String> params, String fields) throws InterruptedException {
        TransientSourceException last = null;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            limiter.await();
            requests.incrementAndGet();
            try {
                return delegate.fetch(apiName, params, fields);
            } catch (TransientSourceException e) {
                failures.incrementAndGet();
                last = e;
                if (attempt + 1 >= maxAttempts) {
                    break;
                }
                Duration backoff = backoffFor(attempt);
                LOG.warn("fetch retry api={} params={} attempt={}/{} backoff_ms={} cause={}",
                        apiName, params, attempt + 1, maxAttempts, backoff.toMillis(), e.getMessage());
                sleeper.sleep(backoff);
            } catch (RuntimeException e) {
                failures.incrementAndGet();
                throw e;
            }
        }
        LOG.error("fetch gave up api={} params={} attempts={}", apiName, params, maxAttempts);
        throw last;
    }

    Duration backoffFor(int attempt) {
        long factor = 1L << Math.min(attempt, 16);
        return Duration.ofMillis(backoffBaseMs * factor);
    }

    @Override
    public int requestCount() {
        return requests.get();
    }

    @Override
    public int failCount() {
        return failures.get();
    }
}
