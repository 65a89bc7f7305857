package com.optionscope.loader;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * One table per dataset category. Categories that were not configured read as empty tables.
 */
public final class LoadedDataSet {
    private final Map<DatasetCategory, RawTable> tables;

    public LoadedDataSet(Map<DatasetCategory, RawTable> tables) {
        EnumMap<DatasetCategory, RawTable> copy = new EnumMap<>(DatasetCategory.class);
        if (tables != null) {
            copy.putAll(tables);
        }
        this.tables = Collections.unmodifiableMap(copy);
    }

    public RawTable table(DatasetCategory category) {
        RawTable table = tables.get(category);
        return table == null ? RawTable.empty(category) : table;
    }
}
