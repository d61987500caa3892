package io.csvchange.validation;

public record ValidationPerformance(double parseMillis, double validationMillis, double totalMillis) {
}
