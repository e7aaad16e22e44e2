package com.marketdw.etl.error;

/**
 * Network or rate-limit failure; safe to retry because every fetch is a read.
 */
public class TransientSourceException extends SourceException {
    public TransientSourceException(String apiName, String message) {
        super(apiName, message);
    }

    public TransientSourceException(String apiName, String message, Throwable cause) {
        super(apiName, message, cause);
    }
}
