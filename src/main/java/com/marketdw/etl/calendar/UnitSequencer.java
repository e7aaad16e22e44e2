package com.marketdw.etl.calendar;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Produces the ordered processing units for a window, never past today.
 */
public final class UnitSequencer {
    private static final Logger LOG = LogManager.getLogger(UnitSequencer.class);

    private final TradeCalendar calendar;
    private final Clock clock;

    public UnitSequencer(TradeCalendar calendar, Clock clock) {
        this.calendar = calendar;
        this.clock = clock;
    }

    public List<Integer> listUnits(int lowerBound) throws SQLException {
        return listUnits(lowerBound, null);
    }

    /**
     * Open units in {@code [lowerBound, upperBound]}; a null upper bound means "up to today".
     * Calendars list future sessions too, so the upper bound is always capped at today.
     */
    public List<Integer> listUnits(int lowerBound, Integer upperBound) throws SQLException {
        int today = today();
        int upper = upperBound == null ? today : Math.min(upperBound, today);
        if (lowerBound > upper) {
            return List.of();
        }
        TreeSet<Integer> ordered = new TreeSet<>();
        for (Integer unit : calendar.listOpenDates(lowerBound, upper)) {
            if (unit != null && unit >= lowerBound && unit <= upper) {
                ordered.add(unit);
            }
        }
        LOG.debug("units lower={} upper={} count={}", lowerBound, upper, ordered.size());
        return new ArrayList<>(ordered);
    }

    /**
     * Most recent open unit that has already started, i.e. the unit a fully caught-up pipeline should hold.
     */
    public Optional<Integer> latestUnit() throws SQLException {
        return calendar.latestOpenDate(today());
    }

    public Optional<Integer> nextUnit(int after) throws SQLException {
        return calendar.nextOpenDate(after);
    }

    public int today() {
        return TradeDates.toUnit(LocalDate.now(clock));
    }
}
