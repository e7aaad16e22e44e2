package com.marketdw.etl.source;

import java.util.Map;

/**
 * Synchronous upstream API. Implementations throw
 * {@link com.marketdw.etl.error.TransientSourceException} for retryable failures and
 * {@link com.marketdw.etl.error.SourceException} for everything else.
 */
public interface MarketDataSource {
    SourceFrame fetch(String apiName, Map<String, String> params, String fields) throws InterruptedException;
}
