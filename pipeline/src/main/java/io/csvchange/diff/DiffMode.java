package io.csvchange.diff;

public enum DiffMode {
    /** Line patch and coarse line counts only. */
    TEXT,
    /** Column presence and order only. */
    SCHEMA,
    /** Row and cell level comparison. */
    STRUCTURED,
    /** STRUCTURED plus the TEXT patch for display. */
    HYBRID
}
