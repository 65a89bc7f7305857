package com.optionscope.utils;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

public class StepTimer {
    private final Map<String, Long> startNanos = new LinkedHashMap<>();
    private final Map<String, Long> durMs = new LinkedHashMap<>();

    public void start(String step) {
        startNanos.put(step, System.nanoTime());
    }

    public void end(String step) {
        Long s = startNanos.remove(step);
        if (s != null) {
            durMs.merge(step, Math.max(0L, (System.nanoTime() - s) / 1_000_000L), Long::sum);
        }
    }

    public Map<String, Long> snapshot() {
        return new LinkedHashMap<>(durMs);
    }

    public String summaryText() {
        StringBuilder sb = new StringBuilder("Step timings\n");
        for (Map.Entry<String, Long> e : durMs.entrySet()) {
            sb.append(String.format(Locale.ROOT, " - %s = %d ms%n", e.getKey(), e.getValue()));
        }
        return sb.toString();
    }
}
