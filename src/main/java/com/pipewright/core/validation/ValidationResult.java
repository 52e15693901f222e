package com.pipewright.core.validation;

import java.util.List;

/**
 * Outcome of validating one step's output. Valid exactly when there are no errors;
 * warnings never affect validity.
 */
public record ValidationResult(boolean valid, List<String> errors, List<String> warnings) {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ValidationResult of(List<String> errors, List<String> warnings) {
        return new ValidationResult(errors == null || errors.isEmpty(), errors, warnings);
    }

    public static ValidationResult invalid(String error) {
        return new ValidationResult(false, List.of(error), List.of());
    }
}
