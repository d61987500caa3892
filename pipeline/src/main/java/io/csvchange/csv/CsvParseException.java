package io.csvchange.csv;

public class CsvParseException extends Exception {
    private final int line;

    public CsvParseException(String message, int line) {
        super(message + " (line " + line + ")");
        this.line = line;
    }

    public int line() { return line; }
}
