package io.csvchange.runtime;

/**
 * Where a watched file is in its update cycle. Steps that are disabled are skipped, so a file may go straight
 * from {@code CHANGE_PENDING} to {@code LOGGED}.
 */
public enum FileState {
    IDLE,
    WATCH_STARTED,
    CHANGE_PENDING,
    BACKING_UP,
    VALIDATING,
    LOGGED,
    HOOKS_RUN,
    DIFFING
}
