package io.csvchange.csv;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parser for RFC 4180 style files with a configurable dialect. Quoted fields may span lines.
 */
public final class CsvParser {
    private final CsvFormat format;

    public CsvParser(CsvFormat format) {
        this.format = format;
    }

    public CsvFormat format() { return format; }

    public CsvTable parse(Path file) throws IOException, CsvParseException {
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    /** First record becomes the header row (values trimmed). */
    public CsvTable parse(String text) throws CsvParseException {
        Records r = records(text);
        if (r.records.isEmpty()) return new CsvTable(List.of(), List.of(), r.skipped);
        List<String> headers = r.records.get(0).stream().map(String::trim).toList();
        return new CsvTable(headers, r.records.subList(1, r.records.size()), r.skipped);
    }

    private record Records(List<List<String>> records, int skipped) {}

    private Records records(String text) throws CsvParseException {
        char delim = format.delimiter();
        char quote = format.quote();
        char escape = format.escape();
        List<List<String>> out = new ArrayList<>();
        List<String> rec = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean inQuotes = false;
        boolean fieldQuoted = false;
        boolean started = false;
        int skipped = 0;
        int line = 1;
        int quoteLine = 1;
        int n = text.length();
        int i = (n > 0 && text.charAt(0) == '\uFEFF') ? 1 : 0;

        while (i < n) {
            char c = text.charAt(i);
            if (inQuotes) {
                if (escape != quote && c == escape && i + 1 < n
                        && (text.charAt(i + 1) == quote || text.charAt(i + 1) == escape)) {
                    field.append(text.charAt(i + 1));
                    i += 2;
                    continue;
                }
                if (c == quote) {
                    if (escape == quote && i + 1 < n && text.charAt(i + 1) == quote) {
                        field.append(quote);
                        i += 2;
                        continue;
                    }
                    inQuotes = false;
                    i++;
                    continue;
                }
                if (c == '\n') line++;
                field.append(c);
                i++;
                continue;
            }
            if (c == quote && field.length() == 0 && !fieldQuoted) {
                inQuotes = true;
                fieldQuoted = true;
                started = true;
                quoteLine = line;
                i++;
            } else if (c == delim) {
                rec.add(finish(field));
                field.setLength(0);
                fieldQuoted = false;
                started = true;
                i++;
            } else if (c == '\r' || c == '\n') {
                if (c == '\r' && i + 1 < n && text.charAt(i + 1) == '\n') i++;
                rec.add(finish(field));
                if (!started && rec.size() == 1) {
                    if (format.skipEmptyLines()) skipped++;
                    else out.add(rec);
                } else {
                    out.add(rec);
                }
                rec = new ArrayList<>();
                field.setLength(0);
                fieldQuoted = false;
                started = false;
                line++;
                i++;
            } else {
                field.append(c);
                started = true;
                i++;
            }
        }
        if (inQuotes) {
            throw new CsvParseException("Unterminated quoted field", quoteLine);
        }
        if (started) {
            rec.add(finish(field));
            out.add(rec);
        }
        return new Records(out, skipped);
    }

    private String finish(StringBuilder field) {
        String v = field.toString();
        return format.trimValues() ? v.trim() : v;
    }

    /** Renders one record in this dialect, quoting fields that need it. */
    public String formatRecord(List<String> values) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) sb.append(format.delimiter());
            sb.append(quoteIfNeeded(values.get(i) == null ? "" : values.get(i)));
        }
        return sb.toString();
    }

    private String quoteIfNeeded(String v) {
        char q = format.quote();
        boolean needs = v.indexOf(format.delimiter()) >= 0 || v.indexOf(q) >= 0
                || v.indexOf('\n') >= 0 || v.indexOf('\r') >= 0;
        if (!needs) return v;
        String esc = String.valueOf(format.escape()) + q;
        return q + v.replace(String.valueOf(q), esc) + q;
    }
}
