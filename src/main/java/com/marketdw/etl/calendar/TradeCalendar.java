package com.marketdw.etl.calendar;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Authoritative list of open trade dates (yyyyMMdd).
 */
public interface TradeCalendar {

    /**
     * Open dates in {@code [lower, upper]}, ascending.
     */
    List<Integer> listOpenDates(int lower, int upper) throws SQLException;

    Optional<Integer> latestOpenDate(int onOrBefore) throws SQLException;

    Optional<Integer> nextOpenDate(int after) throws SQLException;
}
