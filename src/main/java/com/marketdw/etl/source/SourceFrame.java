package com.marketdw.etl.source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tabular payload of one upstream call: field names plus positional rows.
 */
public final class SourceFrame {
    public final List<String> fields;
    public final List<List<Object>> rows;

    public SourceFrame(List<String> fields, List<List<Object>> rows) {
        this.fields = fields == null ? List.of() : List.copyOf(fields);
        List<List<Object>> copy = new ArrayList<>();
        if (rows != null) {
            for (List<Object> row : rows) {
                copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
            }
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public static SourceFrame empty() {
        return new SourceFrame(List.of(), List.of());
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }

    /**
     * Rows projected onto {@code columns} in that order. A column the upstream did not return becomes null.
     */
    public List<List<Object>> project(List<String> columns) {
        int[] index = new int[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            index[i] = fields.indexOf(columns.get(i));
        }
        List<List<Object>> out = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            List<Object> projected = new ArrayList<>(index.length);
            for (int idx : index) {
                projected.add(idx >= 0 && idx < row.size() ? row.get(idx) : null);
            }
            out.add(projected);
        }
        return out;
    }
}
