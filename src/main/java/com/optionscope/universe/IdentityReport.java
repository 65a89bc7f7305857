package com.optionscope.universe;

import java.util.List;

public final class IdentityReport {
    public final int checkedIds;
    public final List<IdentityViolation> violations;

    public IdentityReport(int checkedIds, List<IdentityViolation> violations) {
        this.checkedIds = Math.max(0, checkedIds);
        this.violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public int violationCount() {
        return violations.size();
    }

    public boolean isClean() {
        return violations.isEmpty();
    }
}
