package io.csvchange.diff;

import java.util.List;

public record DiffStatistics(Counts totalRows,
                             Counts totalColumns,
                             Changes changes,
                             List<String> affectedColumns,
                             double changePercentage,
                             List<ColumnChangeCount> mostChangedColumns) {

    public record Counts(int old, int current) {}

    public record Changes(int added, int removed, int modified, int moved, int unchanged) {
        public int total() { return added + removed + modified + moved; }
    }

    public DiffStatistics {
        affectedColumns = List.copyOf(affectedColumns);
        mostChangedColumns = List.copyOf(mostChangedColumns);
    }
}
