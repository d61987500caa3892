package io.csvchange.validation;

import io.csvchange.csv.CsvFormat;

/**
 * @param strictMode undeclared columns are rejected even when the schema allows them
 * @param maxErrors  error collection stops once this many errors were recorded
 */
public record ValidationOptions(boolean strictMode,
                                int maxErrors,
                                boolean enableWarnings,
                                boolean performanceTracking,
                                CsvFormat format,
                                ValidationSchema schema) {

    public static ValidationOptions defaults() {
        return new ValidationOptions(false, 100, true, true, CsvFormat.DEFAULT, null);
    }

    public ValidationOptions withSchema(ValidationSchema s) { return new ValidationOptions(strictMode, maxErrors, enableWarnings, performanceTracking, format, s); }
    public ValidationOptions withMaxErrors(int m) { return new ValidationOptions(strictMode, m, enableWarnings, performanceTracking, format, schema); }
    public ValidationOptions withStrictMode(boolean s) { return new ValidationOptions(s, maxErrors, enableWarnings, performanceTracking, format, schema); }
    public ValidationOptions withWarnings(boolean w) { return new ValidationOptions(strictMode, maxErrors, w, performanceTracking, format, schema); }
    public ValidationOptions withPerformanceTracking(boolean p) { return new ValidationOptions(strictMode, maxErrors, enableWarnings, p, format, schema); }
    public ValidationOptions withFormat(CsvFormat f) { return new ValidationOptions(strictMode, maxErrors, enableWarnings, performanceTracking, f, schema); }
}
