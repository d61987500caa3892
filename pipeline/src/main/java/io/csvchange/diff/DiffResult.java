package io.csvchange.diff;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of one comparison. Filtering produces a new instance.
 */
public record DiffResult(DiffMode mode,
                         Instant timestamp,
                         SourceFiles sourceFiles,
                         DiffStatistics statistics,
                         List<SchemaChange> schemaChanges,
                         List<RowChange> rowChanges,
                         String textDiff,
                         Map<String, Object> structuredDiff,
                         DiffMetadata metadata) {

    public record SourceFiles(String old, String current) {}

    public DiffResult {
        schemaChanges = List.copyOf(schemaChanges);
        rowChanges = List.copyOf(rowChanges);
    }

    public List<RowChange> rowsOfType(ChangeType type) {
        return rowChanges.stream().filter(r -> r.changeType() == type).toList();
    }

    public boolean hasChanges() {
        return !schemaChanges.isEmpty() || statistics.changes().total() > 0;
    }

    public DiffResult withOldSource(String label) {
        return new DiffResult(mode, timestamp, new SourceFiles(label, sourceFiles.current()), statistics,
                schemaChanges, rowChanges, textDiff, structuredDiff, metadata);
    }
}
