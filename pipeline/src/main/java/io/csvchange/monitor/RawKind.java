package io.csvchange.monitor;

/**
 * Uninterpreted filesystem notification, before debouncing and classification.
 */
public enum RawKind {
    CREATE,
    MODIFY,
    DELETE,
    RENAME
}
