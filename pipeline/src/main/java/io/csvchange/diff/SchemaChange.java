package io.csvchange.diff;

/** Column-level change; indices are 0-based header positions. */
public record SchemaChange(ChangeType changeType, String columnName, Integer oldIndex, Integer newIndex) {
}
