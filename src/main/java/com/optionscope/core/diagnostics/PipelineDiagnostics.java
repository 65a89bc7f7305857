package com.optionscope.core.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counters and coverage ratios collected while a reconciliation run executes. Only the pipeline
 * records into it; readers see unmodifiable views.
 */
public final class PipelineDiagnostics {
    private final Map<String, ConfigItem> configValues = new LinkedHashMap<>();
    private final Map<String, Integer> rowsByCategory = new LinkedHashMap<>();
    private final Map<String, Integer> filesByCategory = new LinkedHashMap<>();
    private final Map<String, Integer> counterValues = new LinkedHashMap<>();
    private final Map<String, CoverageMetric> coverageValues = new LinkedHashMap<>();
    private final Map<String, Long> stepValues = new LinkedHashMap<>();
    private final List<String> noteValues = new ArrayList<>();

    public final String runLabel;
    public final Map<String, ConfigItem> configSnapshot = Collections.unmodifiableMap(configValues);
    public final Map<String, Integer> categoryRows = Collections.unmodifiableMap(rowsByCategory);
    public final Map<String, Integer> categoryFiles = Collections.unmodifiableMap(filesByCategory);
    public final Map<String, Integer> counters = Collections.unmodifiableMap(counterValues);
    public final Map<String, CoverageMetric> coverages = Collections.unmodifiableMap(coverageValues);
    public final Map<String, Long> stepMillis = Collections.unmodifiableMap(stepValues);
    public final List<String> notes = Collections.unmodifiableList(noteValues);

    public PipelineDiagnostics(String runLabel) {
        this.runLabel = runLabel == null ? "" : runLabel;
    }

    public void addConfig(ConfigItem item) {
        if (item == null || isBlank(item.key)) {
            return;
        }
        configValues.put(item.key, item);
    }

    public void addCategory(String category, int rows, int files) {
        if (isBlank(category)) {
            return;
        }
        rowsByCategory.put(category, Math.max(0, rows));
        filesByCategory.put(category, Math.max(0, files));
    }

    public void addCounter(String key, int count) {
        if (isBlank(key)) {
            return;
        }
        counterValues.put(key, Math.max(0, count));
    }

    public int counter(String key) {
        return counterValues.getOrDefault(key, 0);
    }

    public void addCoverage(String key, int numerator, int denominator) {
        if (isBlank(key)) {
            return;
        }
        coverageValues.put(key, new CoverageMetric(key, numerator, denominator));
    }

    public void addStepTimes(Map<String, Long> timings) {
        if (timings != null) {
            stepValues.putAll(timings);
        }
    }

    public void addNote(String note) {
        if (isBlank(note)) {
            return;
        }
        noteValues.add(note.trim());
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    public static final class ConfigItem {
        public final String key;
        public final String value;
        public final String source;

        public ConfigItem(String key, String value, String source) {
            this.key = key;
            this.value = value == null ? "" : value;
            this.source = source == null ? "default" : source;
        }
    }

    public static final class CoverageMetric {
        public final String key;
        public final int numerator;
        public final int denominator;
        public final double pct;

        private CoverageMetric(String key, int numerator, int denominator) {
            this.key = key;
            this.numerator = Math.max(0, numerator);
            this.denominator = Math.max(0, denominator);
            this.pct = this.denominator <= 0 ? 0.0 : this.numerator * 100.0 / this.denominator;
        }
    }
}
