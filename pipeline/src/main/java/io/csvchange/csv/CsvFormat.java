package io.csvchange.csv;

/**
 * Dialect of a delimited file. When {@code escape == quote} a doubled quote inside a quoted field stands for one quote.
 */
public record CsvFormat(char delimiter, char quote, char escape, boolean skipEmptyLines, boolean trimValues) {

    public static final CsvFormat DEFAULT = new CsvFormat(',', '"', '"', true, true);

    public CsvFormat withDelimiter(char d) { return new CsvFormat(d, quote, escape, skipEmptyLines, trimValues); }
    public CsvFormat withQuote(char q) { return new CsvFormat(delimiter, q, escape, skipEmptyLines, trimValues); }
    public CsvFormat withEscape(char e) { return new CsvFormat(delimiter, quote, e, skipEmptyLines, trimValues); }
    public CsvFormat withSkipEmptyLines(boolean s) { return new CsvFormat(delimiter, quote, escape, s, trimValues); }
    public CsvFormat withTrimValues(boolean t) { return new CsvFormat(delimiter, quote, escape, skipEmptyLines, t); }
}
