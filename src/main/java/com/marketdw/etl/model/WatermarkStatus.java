package com.marketdw.etl.model;

public enum WatermarkStatus {
    SUCCESS,
    FAILED
}
