package io.csvchange.diff;

public record CellChange(String column, String oldValue, String newValue, ChangeType changeType) {
}
