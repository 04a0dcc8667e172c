package com.phasegate.core.validation;

import java.io.Serializable;
import java.util.List;

/**
 * Pass/fail outcome of a phase validator.
 */
public record ValidationResult(
    boolean passed,
    List<String> errors
) implements Serializable {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ValidationResult pass() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult fail(String... errors) {
        return new ValidationResult(false, List.of(errors));
    }

    public static ValidationResult fail(List<String> errors) {
        return new ValidationResult(false, errors);
    }
}
