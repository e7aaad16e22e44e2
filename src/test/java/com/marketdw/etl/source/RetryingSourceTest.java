package com.marketdw.etl.source;

import com.marketdw.etl.error.SourceException;
import com.marketdw.etl.error.TransientSourceException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RetryingSourceTest {
    private final List<Duration> slept = new ArrayList<>();
    private final RateLimiter unlimited = new RateLimiter(60_000, () -> 0L, d -> { });

    @Test
    void transientFailuresShouldBeRetriedWithExponentialBackoff() throws Exception {
        ScriptedSource delegate = new ScriptedSource(2, false);
        RetryingSource source = new RetryingSource(delegate, unlimited, 5, 100L, slept::add);

        SourceFrame frame = source.fetch("daily", Map.of("trade_date", "20240105"), "ts_code");

        assertSame(ScriptedSource.FRAME, frame);
        assertEquals(3, delegate.calls);
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), slept);
        assertEquals(3, source.requestCount());
        assertEquals(2, source.failCount());
    }

    @Test
    void exhaustedRetriesShouldRethrowLastTransientError() {
        ScriptedSource delegate = new ScriptedSource(10, false);
        RetryingSource source = new RetryingSource(delegate, unlimited, 3, 50L, slept::add);

        assertThrows(TransientSourceException.class, () -> source.fetch("daily", Map.of(), ""));

        assertEquals(3, delegate.calls);
        assertEquals(2, slept.size());
        assertEquals(3, source.failCount());
    }

    @Test
    void permanentErrorsShouldNotBeRetried() {
        ScriptedSource delegate = new ScriptedSource(0, true);
        RetryingSource source = new RetryingSource(delegate, unlimited, 5, 50L, slept::add);

        assertThrows(SourceException.class, () -> source.fetch("daily", Map.of(), ""));

        assertEquals(1, delegate.calls);
        assertEquals(0, slept.size());
        assertEquals(1, source.failCount());
    }

    private static final class ScriptedSource implements MarketDataSource {
        static final SourceFrame FRAME = new SourceFrame(List.of("ts_code"), List.of(List.of("000001.SZ")));
        private final int transientFailures;
        private final boolean permanent;
        int calls;

        ScriptedSource(int transientFailures, boolean permanent) {
            this.transientFailures = transientFailures;
            this.permanent = permanent;
        }

        @Override
        public SourceFrame fetch(String apiName, Map<String, String> params, String fields) {
            calls++;
            if (permanent) {
                throw new SourceException(apiName, "api error code=2002");
            }
            if (calls <= transientFailures) {
                throw new TransientSourceException(apiName, "rate limited");
            }
            return FRAME;
        }
    }
}
