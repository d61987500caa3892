package io.csvchange.validation;

import java.util.Map;

/**
 * Derived facts about a file. {@code dataTypes} maps each header to its inferred {@link ValueType} name,
 * in header order.
 */
public record ValidationMetadata(long fileSize,
                                 String encoding,
                                 String delimiter,
                                 String quoteChar,
                                 String escapeChar,
                                 boolean hasHeaders,
                                 int columnCount,
                                 int emptyRows,
                                 int duplicateRows,
                                 Map<String, String> dataTypes) {
}
