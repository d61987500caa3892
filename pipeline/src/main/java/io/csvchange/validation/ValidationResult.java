package io.csvchange.validation;

import java.util.List;

public record ValidationResult(boolean valid,
                               List<String> headers,
                               Integer rowCount,
                               List<ValidationError> errors,
                               List<ValidationWarning> warnings,
                               ValidationMetadata metadata,
                               ValidationPerformance performance) {

    public ValidationResult {
        headers = headers == null ? null : List.copyOf(headers);
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    static ValidationResult failed(ValidationError error) {
        return new ValidationResult(false, null, null, List.of(error), List.of(), null, null);
    }

    public List<String> errorMessages() { return errors.stream().map(ValidationError::message).toList(); }

    public List<String> warningMessages() { return warnings.stream().map(ValidationWarning::message).toList(); }

    public boolean hasErrorCode(String code) {
        return errors.stream().anyMatch(e -> code.equals(e.code()));
    }
}
