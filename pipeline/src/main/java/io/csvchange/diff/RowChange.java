package io.csvchange.diff;

import java.util.List;
import java.util.Map;

/**
 * One changed row. {@code rowIndex} is the 0-based data-row position in the new file, or in the old file for
 * removals. {@code rowId} is the key identity when key columns are configured.
 */
public record RowChange(int rowIndex,
                        String rowId,
                        ChangeType changeType,
                        List<CellChange> cellChanges,
                        Map<String, String> oldRow,
                        Map<String, String> newRow,
                        Double similarity,
                        Integer oldIndex,
                        Integer newIndex) {

    public RowChange {
        cellChanges = cellChanges == null ? List.of() : List.copyOf(cellChanges);
    }

    RowChange withCellChanges(List<CellChange> cells) {
        return new RowChange(rowIndex, rowId, changeType, cells, oldRow, newRow, similarity, oldIndex, newIndex);
    }
}
