package io.csvchange.diff;

import io.csvchange.csv.CsvFormat;

import java.util.List;

/**
 * @param minSimilarity   leftover rows pair as MODIFIED only at or above this share of equal common-column values
 * @param proximityWindow leftover rows pair only if their positions differ by at most this many rows
 * @param topColumns      length of {@link DiffStatistics#mostChangedColumns()}
 */
public record DiffOptions(DiffMode mode,
                          List<String> keyColumns,
                          DiffFilter filter,
                          CsvFormat format,
                          boolean rowMatching,
                          boolean moveDetection,
                          int maxRowsToProcess,
                          double minSimilarity,
                          int proximityWindow,
                          int topColumns) {

    public DiffOptions {
        keyColumns = keyColumns == null ? List.of() : List.copyOf(keyColumns);
        filter = filter == null ? DiffFilter.NONE : filter;
        format = format == null ? CsvFormat.DEFAULT : format;
    }

    public static DiffOptions defaults() {
        return new DiffOptions(DiffMode.HYBRID, List.of(), DiffFilter.NONE, CsvFormat.DEFAULT, true, true, 100_000, 0.5, 10, 10);
    }

    public DiffOptions withMode(DiffMode m) { return new DiffOptions(m, keyColumns, filter, format, rowMatching, moveDetection, maxRowsToProcess, minSimilarity, proximityWindow, topColumns); }
    public DiffOptions withKeyColumns(List<String> k) { return new DiffOptions(mode, k, filter, format, rowMatching, moveDetection, maxRowsToProcess, minSimilarity, proximityWindow, topColumns); }
    public DiffOptions withFilter(DiffFilter f) { return new DiffOptions(mode, keyColumns, f, format, rowMatching, moveDetection, maxRowsToProcess, minSimilarity, proximityWindow, topColumns); }
    public DiffOptions withFormat(CsvFormat f) { return new DiffOptions(mode, keyColumns, filter, f, rowMatching, moveDetection, maxRowsToProcess, minSimilarity, proximityWindow, topColumns); }
    public DiffOptions withRowMatching(boolean b) { return new DiffOptions(mode, keyColumns, filter, format, b, moveDetection, maxRowsToProcess, minSimilarity, proximityWindow, topColumns); }
    public DiffOptions withMoveDetection(boolean b) { return new DiffOptions(mode, keyColumns, filter, format, rowMatching, b, maxRowsToProcess, minSimilarity, proximityWindow, topColumns); }
    public DiffOptions withMaxRows(int n) { return new DiffOptions(mode, keyColumns, filter, format, rowMatching, moveDetection, n, minSimilarity, proximityWindow, topColumns); }
    public DiffOptions withSimilarity(double s, int window) { return new DiffOptions(mode, keyColumns, filter, format, rowMatching, moveDetection, maxRowsToProcess, s, window, topColumns); }
}
