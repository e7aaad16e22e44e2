package com.marketdw.etl.layer;

import com.marketdw.etl.calendar.TradeDates;
import com.marketdw.etl.source.SourceFrame;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Converts upstream frames to store rows. Date fields arrive as yyyyMMdd text and are stored as integers.
 */
final class FrameRows {
    private FrameRows() {
    }

    static List<List<Object>> toRows(SourceFrame frame, List<String> columns, Set<String> dateColumns) {
        List<List<Object>> projected = frame.project(columns);
        List<List<Object>> out = new ArrayList<>(projected.size());
        for (List<Object> row : projected) {
            List<Object> converted = new ArrayList<>(row.size());
            for (int i = 0; i < row.size(); i++) {
                Object value = row.get(i);
                converted.add(dateColumns.contains(columns.get(i)) ? toUnit(value) : value);
            }
            out.add(converted);
        }
        return out;
    }

    static Integer toUnit(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : TradeDates.parse(text);
    }
}
