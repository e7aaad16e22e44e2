package com.marketdw.etl.error;

import java.util.List;

/**
 * One or more chunks of a parallel backfill did not complete. The shared watermark was not moved.
 */
public class ChunkFailureException extends RuntimeException {
    private final String layerName;
    private final List<String> failedChunks;

    public ChunkFailureException(String layerName, List<String> failedChunks, Throwable cause) {
        super("chunked backfill failed layer=" + layerName + " failed_chunks=" + failedChunks, cause);
        this.layerName = layerName;
        this.failedChunks = List.copyOf(failedChunks);
    }

    public String layerName() {
        return layerName;
    }

    public List<String> failedChunks() {
        return failedChunks;
    }
}
