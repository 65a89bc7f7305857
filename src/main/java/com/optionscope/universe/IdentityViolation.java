package com.optionscope.universe;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A contract id observed with more than one description.
 */
public record IdentityViolation(String contractId, Set<String> descriptions, Set<String> sourceFiles) {
    public IdentityViolation {
        descriptions = Collections.unmodifiableSet(new LinkedHashSet<>(descriptions));
        sourceFiles = Collections.unmodifiableSet(new LinkedHashSet<>(sourceFiles));
    }
}
