package com.marketdw.etl.health;

public enum TableHealth {
    OK,
    STALE,
    EMPTY,
    UNKNOWN,
    ERROR
}
