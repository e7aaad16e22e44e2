package com.marketdw.etl.error;

/**
 * Upstream data-source failure that retrying will not fix.
 */
public class SourceException extends RuntimeException {
    private final String apiName;

    public SourceException(String apiName, String message) {
        super(message);
        this.apiName = apiName;
    }

    public SourceException(String apiName, String message, Throwable cause) {
        super(message, cause);
        this.apiName = apiName;
    }

    public String apiName() {
        return apiName;
    }
}
