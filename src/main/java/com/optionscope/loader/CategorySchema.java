package com.optionscope.loader;

import java.util.ArrayList;
import java.util.List;

/**
 * Declared column set of one dataset category. Required columns must appear in every file of the
 * category; optional ones are typed when present.
 */
public record CategorySchema(List<String> required, List<String> optional) {
    public CategorySchema {
        required = required == null ? List.of() : List.copyOf(required);
        optional = optional == null ? List.of() : List.copyOf(optional);
    }

    public static CategorySchema of(List<String> required, List<String> optional) {
        return new CategorySchema(required, optional);
    }

    public List<String> declaredColumns() {
        List<String> out = new ArrayList<>(required);
        out.addAll(optional);
        return out;
    }

    public List<String> missingRequired(List<String> header) {
        List<String> missing = new ArrayList<>();
        for (String column : required) {
            if (!header.contains(column)) {
                missing.add(column);
            }
        }
        return missing;
    }
}
