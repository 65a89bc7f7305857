package com.optionscope.loader;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable row table for a single dataset category.
 */
public final class RawTable {
    private final DatasetCategory category;
    private final List<String> columns;
    private final List<RawRow> rows;

    public RawTable(DatasetCategory category, List<String> columns, List<RawRow> rows) {
        this.category = category;
        this.columns = columns == null ? List.of() : List.copyOf(columns);
        this.rows = rows == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public static RawTable empty(DatasetCategory category) {
        return new RawTable(category, category.schema().declaredColumns(), List.of());
    }

    /**
     * Row-concatenates tables of the same category. Columns are the union in first-seen order;
     * a row whose file lacked a column reads null for it.
     */
    public static RawTable concat(DatasetCategory category, List<RawTable> parts) {
        if (parts == null || parts.isEmpty()) {
            return empty(category);
        }
        Set<String> columns = new LinkedHashSet<>();
        List<RawRow> rows = new ArrayList<>();
        for (RawTable part : parts) {
            if (part.category != category) {
                throw new IllegalArgumentException("cannot concat " + part.category + " into " + category);
            }
            columns.addAll(part.columns);
            rows.addAll(part.rows);
        }
        return new RawTable(category, new ArrayList<>(columns), rows);
    }

    public DatasetCategory category() {
        return category;
    }

    public List<String> columns() {
        return columns;
    }

    public List<RawRow> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public Set<String> sourceFiles() {
        Set<String> out = new LinkedHashSet<>();
        for (RawRow row : rows) {
            out.add(row.sourceFile);
        }
        return out;
    }
}
