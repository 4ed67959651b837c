package com.keystone.utilities.validation;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a validation: either valid (no errors) or invalid with every error found.
 *
 * @param valid  true if validation passed with no errors
 * @param errors human-readable error messages (empty when valid)
 */
public record ValidationResult(boolean valid, List<String> errors) {

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult fail(List<String> errors) {
        return new ValidationResult(false, errors);
    }

    public static ValidationResult fail(String error) {
        return fail(List.of(error));
    }

    /** Combines two results; the combination is valid only if both are. */
    public ValidationResult and(ValidationResult other) {
        if (valid && other.valid) {
            return ok();
        }
        List<String> combined = new ArrayList<>(errors);
        combined.addAll(other.errors);
        return fail(combined);
    }

    /** Errors joined with "; ", or an empty string when valid. */
    public String message() {
        return String.join("; ", errors);
    }
}
