package com.marketdw.etl.runner;

public enum ChunkGranularity {
    NONE,
    YEAR,
    MONTH;

    public static ChunkGranularity fromText(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return NONE;
        }
        try {
            return valueOf(raw.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("chunk-by must be one of none, year, month: " + raw, e);
        }
    }
}
