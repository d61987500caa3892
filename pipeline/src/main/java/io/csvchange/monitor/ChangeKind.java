package io.csvchange.monitor;

public enum ChangeKind {
    ADDED,
    CHANGED,
    RENAMED,
    DELETED;

    /** Kinds that carry new content worth backing up and validating. */
    public boolean carriesContent() {
        return this == ADDED || this == CHANGED;
    }
}
