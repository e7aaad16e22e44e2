package com.marketdw.etl.source;

/**
 * Counters copied into {@code request_count} / {@code fail_count} of the run log.
 */
public interface RequestStats {
    RequestStats NONE = new RequestStats() {
        @Override
        public int requestCount() {
            return 0;
        }

        @Override
        public int failCount() {
            return 0;
        }
    };

    int requestCount();

    int failCount();
}
