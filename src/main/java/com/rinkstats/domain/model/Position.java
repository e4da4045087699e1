package com.rinkstats.domain.model;

/**
 * Roster position codes used by both sources.
 */
public enum Position {
    C,
    L,
    R,
    D,
    G;

    public boolean isForward() {
        return this == C || this == L || this == R;
    }

    public boolean isGoalie() {
        return this == G;
    }

    /**
     * Returns the position for a source code, or null when the code is blank or unknown.
     */
    public static Position fromCode(String code) {
        if (code == null) {
            return null;
        }
        String trimmed = code.trim().toUpperCase();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (trimmed.equals("F")) {
            return C;
        }
        try {
            return valueOf(trimmed.substring(0, 1));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
