package io.csvchange.diff;

public record ColumnChangeCount(String column, int changeCount, double changePercentage) {
}
