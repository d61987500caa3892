package io.csvchange.validation;

public record ValidationWarning(WarningType type,
                                String message,
                                Integer row,
                                String column,
                                String value,
                                String suggestion) {
}
