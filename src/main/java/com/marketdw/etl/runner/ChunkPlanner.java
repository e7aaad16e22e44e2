package com.marketdw.etl.runner;

import com.marketdw.etl.calendar.TradeDates;
import com.marketdw.etl.model.UnitRange;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits an inclusive date range into disjoint, calendar-aligned sub-ranges.
 */
public final class ChunkPlanner {

    private ChunkPlanner() {
    }

    public static List<UnitRange> plan(int start, int end, ChunkGranularity granularity) {
        if (end < start) {
            throw new IllegalArgumentException("end date " + end + " is before start date " + start);
        }
        if (granularity == null || granularity == ChunkGranularity.NONE) {
            return List.of(UnitRange.of(start, end));
        }
        LocalDate endDate = TradeDates.toDate(end);
        LocalDate cursor = TradeDates.toDate(start);
        List<UnitRange> chunks = new ArrayList<>();
        while (!cursor.isAfter(endDate)) {
            LocalDate periodEnd = granularity == ChunkGranularity.YEAR
                    ? LocalDate.of(cursor.getYear(), 12, 31)
                    : YearMonth.from(cursor).atEndOfMonth();
            LocalDate chunkEnd = periodEnd.isAfter(endDate) ? endDate : periodEnd;
            chunks.add(UnitRange.of(TradeDates.toUnit(cursor), TradeDates.toUnit(chunkEnd)));
            cursor = chunkEnd.plusDays(1);
        }
        return chunks;
    }
}
