package io.csvchange.validation;

import java.util.Map;
import java.util.Optional;

/**
 * Cell-level check. Called once per (row, column); implementations decide which columns they care about.
 * A thrown exception is reported as a warning naming the validator, never as a failed validation.
 */
public interface FieldValidator {
    String name();

    String description();

    /**
     * @param rowIndex 0-based index among data rows
     */
    Optional<ValidationError> validate(String value, Map<String, String> row, int rowIndex, String column);

    @FunctionalInterface
    interface Check {
        Optional<ValidationError> apply(String value, Map<String, String> row, int rowIndex, String column);
    }

    static FieldValidator of(String name, String description, Check check) {
        return new FieldValidator() {
            @Override public String name() { return name; }
            @Override public String description() { return description; }
            @Override public Optional<ValidationError> validate(String value, Map<String, String> row, int rowIndex, String column) {
                return check.apply(value, row, rowIndex, column);
            }
            @Override public String toString() { return "FieldValidator[" + name + "]"; }
        };
    }
}
