package io.csvchange.csv;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parsed file: the header row and the data records below it. Records keep their raw field count.
 */
public record CsvTable(List<String> headers, List<List<String>> rows, int skippedEmptyLines) {

    public CsvTable {
        headers = List.copyOf(headers);
        rows = rows.stream().map(List::copyOf).toList();
    }

    public static CsvTable empty() { return new CsvTable(List.of(), List.of(), 0); }

    public int rowCount() { return rows.size(); }

    public int columnCount() { return headers.size(); }

    /** Value at {@code (row, column)}; missing trailing fields read as "". */
    public String value(int row, int column) {
        List<String> r = rows.get(row);
        return column < r.size() ? r.get(column) : "";
    }

    /** Header name to value, in header order. Later duplicate headers win. */
    public Map<String, String> rowAsMap(int row) {
        Map<String, String> m = new LinkedHashMap<>();
        for (int c = 0; c < headers.size(); c++) m.put(headers.get(c), value(row, c));
        return Collections.unmodifiableMap(m);
    }

    public CsvTable limit(int maxRows) {
        if (rows.size() <= maxRows) return this;
        return new CsvTable(headers, rows.subList(0, maxRows), skippedEmptyLines);
    }
}
