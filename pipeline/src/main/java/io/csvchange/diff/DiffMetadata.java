package io.csvchange.diff;

import java.util.List;

/**
 * @param truncated at least one input exceeded {@code maxRowsToProcess}; the result covers only the leading rows
 */
public record DiffMetadata(double processingMillis,
                           boolean truncated,
                           int maxRowsToProcess,
                           List<String> keyColumns,
                           boolean filtered) {
}
