package com.optionscope.rank;

import java.util.Locale;

/**
 * How equal values are ranked. One policy applies to every rank computation of a run.
 */
public enum TieBreak {
    /** Equal values share a rank; distinct values take consecutive ranks. */
    DENSE,
    /** Ordinal rank; equal values are ordered by first appearance. */
    FIRST;

    public static TieBreak parse(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return DENSE;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("rank.tie_break must be DENSE or FIRST, got: " + raw, e);
        }
    }
}
