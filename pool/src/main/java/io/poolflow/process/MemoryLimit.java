package io.poolflow.process;

import java.util.Locale;

/**
 * Address-space limit applied to external commands, sized to the job's cost.
 */
public enum MemoryLimit {
    /** No limit; the cost is an estimate only. */
    NONE,
    /** Soft limit at the cost, hard limit left unlimited so the process may raise it. */
    SOFT,
    /** Soft and hard limits at the cost; the process fails rather than exceed it. */
    HARD;

    public static MemoryLimit parse(String s) {
        if (s == null || s.isBlank()) return NONE;
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown memory limit mode '" + s + "', expected none|soft|hard", e);
        }
    }
}
