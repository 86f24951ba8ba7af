package com.signalmix.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered, header-aware table of text cells. A null cell means the value is missing.
 */
public final class Table {
    private final List<String> columns;
    private final List<Map<String, String>> rows = new ArrayList<>();

    public Table(List<String> columns) {
        Set<String> unique = new LinkedHashSet<>();
        if (columns != null) {
            for (String column : columns) {
                if (column != null) {
                    unique.add(column);
                }
            }
        }
        this.columns = List.copyOf(unique);
    }

    public static Table empty(List<String> columns) {
        return new Table(columns);
    }

    public List<String> columns() {
        return columns;
    }

    public boolean hasColumn(String column) {
        return column != null && columns.contains(column);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Adds a row; keys outside the header are ignored, absent keys become missing cells.
     */
    public Table addRow(Map<String, String> values) {
        Map<String, String> row = new LinkedHashMap<>();
        for (String column : columns) {
            String value = values == null ? null : values.get(column);
            row.put(column, value);
        }
        rows.add(row);
        return this;
    }

    public String get(int rowIndex, String column) {
        if (rowIndex < 0 || rowIndex >= rows.size()) {
            return null;
        }
        return rows.get(rowIndex).get(column);
    }

    public Map<String, String> row(int rowIndex) {
        return Collections.unmodifiableMap(rows.get(rowIndex));
    }

    public List<Map<String, String>> rows() {
        List<Map<String, String>> out = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            out.add(Collections.unmodifiableMap(row));
        }
        return out;
    }

    public List<String> column(String column) {
        List<String> out = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            out.add(row.get(column));
        }
        return out;
    }
}
