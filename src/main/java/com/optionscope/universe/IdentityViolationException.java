package com.optionscope.universe;

import java.util.stream.Collectors;

/**
 * Raised only under the strict identity policy.
 */
public class IdentityViolationException extends IllegalStateException {
    private static final int MAX_LISTED = 10;

    private final IdentityReport report;

    public IdentityViolationException(IdentityReport report) {
        super(describe(report));
        this.report = report;
    }

    public IdentityReport report() {
        return report;
    }

    private static String describe(IdentityReport report) {
        String ids = report.violations.stream()
                .limit(MAX_LISTED)
                .map(IdentityViolation::contractId)
                .collect(Collectors.joining(","));
        return report.violationCount() + " contract id(s) with unstable description: " + ids
                + (report.violationCount() > MAX_LISTED ? ",..." : "");
    }
}
