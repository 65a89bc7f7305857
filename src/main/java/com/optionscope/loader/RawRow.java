package com.optionscope.loader;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One loaded row, stamped with the file it came from. Blank cells and columns the file did not
 * carry both read as {@code null}.
 */
public final class RawRow {
    public final String sourceFile;
    private final Map<String, String> values;

    public RawRow(String sourceFile, Map<String, String> values) {
        this.sourceFile = sourceFile;
        this.values = values == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public String get(String column) {
        return values.get(column);
    }

    @Override
    public String toString() {
        return "RawRow{source=" + sourceFile + ", values=" + values + "}";
    }
}
