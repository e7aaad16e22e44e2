package com.marketdw.etl.model;

/**
 * Lifecycle state shared by run-log and retry-guard rows.
 */
public enum RunStatus {
    RUNNING,
    SUCCESS,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }

    public static RunStatus fromText(String raw) {
        if (raw == null) {
            return FAILED;
        }
        String value = raw.trim().toUpperCase();
        for (RunStatus status : values()) {
            if (status.name().equals(value)) {
                return status;
            }
        }
        return FAILED;
    }
}
