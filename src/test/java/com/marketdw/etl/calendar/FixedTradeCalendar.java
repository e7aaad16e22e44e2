package com.marketdw.etl.calendar;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Calendar backed by an explicit set of open dates.
 */
public final class FixedTradeCalendar implements TradeCalendar {
    private final TreeSet<Integer> open = new TreeSet<>();

    public FixedTradeCalendar(Integer... openDates) {
        for (Integer d : openDates) {
            open.add(d);
        }
    }

    /**
     * Monday to Friday between the two dates, inclusive.
     */
    public static FixedTradeCalendar weekdays(int from, int to) {
        FixedTradeCalendar calendar = new FixedTradeCalendar();
        LocalDate cursor = TradeDates.toDate(from);
        LocalDate end = TradeDates.toDate(to);
        while (!cursor.isAfter(end)) {
            int dow = cursor.getDayOfWeek().getValue();
            if (dow <= 5) {
                calendar.open.add(TradeDates.toUnit(cursor));
            }
            cursor = cursor.plusDays(1);
        }
        return calendar;
    }

    @Override
    public List<Integer> listOpenDates(int lower, int upper) {
        if (lower > upper) {
            return List.of();
        }
        return new ArrayList<>(open.subSet(lower, true, upper, true));
    }

    @Override
    public Optional<Integer> latestOpenDate(int onOrBefore) {
        return Optional.ofNullable(open.floor(onOrBefore));
    }

    @Override
    public Optional<Integer> nextOpenDate(int after) {
        return Optional.ofNullable(open.higher(after));
    }
}
