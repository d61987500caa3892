package io.csvchange.validation;

/**
 * One finding. {@code row} is the 1-based line number in the file (the header is line 1), or null for file-level findings.
 */
public record ValidationError(ErrorType type,
                              Severity severity,
                              String code,
                              String message,
                              Integer row,
                              String column,
                              String value,
                              String expected) {

    public static ValidationError of(ErrorType type, Severity severity, String code, String message) {
        return new ValidationError(type, severity, code, message, null, null, null, null);
    }

    public static ValidationError ofValue(ErrorType type, Severity severity, String code, String message, String value) {
        return new ValidationError(type, severity, code, message, null, null, value, null);
    }

    public ValidationError at(int row, String column) {
        return new ValidationError(type, severity, code, message, row, column, value, expected);
    }

    public ValidationError expecting(String e) {
        return new ValidationError(type, severity, code, message, row, column, value, e);
    }

    public boolean blocking() { return severity != Severity.WARNING; }
}
