package com.marketdw.etl.model;

public enum RunType {
    FULL,
    INCREMENTAL;

    public String label() {
        return name().toLowerCase();
    }
}
