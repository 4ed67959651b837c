package com.keystone.utilities.validation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Collects every failed rule for one object instead of stopping at the first.
 * Obtained from {@link ValidationUtility#check()}.
 */
public final class Validator {

    private final Pattern identifierPattern;
    private final List<String> errors = new ArrayList<>();

    Validator(Pattern identifierPattern) {
        this.identifierPattern = identifierPattern;
    }

    public Validator notBlank(String field, String value) {
        if (value == null || value.isBlank()) {
            errors.add(field + " must not be null or blank");
        }
        return this;
    }

    public Validator notNull(String field, Object value) {
        if (value == null) {
            errors.add(field + " must not be null");
        }
        return this;
    }

    /** Lower-case identifier such as a tenant id or feature flag. */
    public Validator identifier(String field, String value) {
        if (value == null || value.isBlank()) {
            errors.add(field + " must not be null or blank");
        } else if (!identifierPattern.matcher(value).matches()) {
            errors.add(field + " '%s' must match %s".formatted(value, identifierPattern.pattern()));
        }
        return this;
    }

    public Validator identifiers(String field, Collection<String> values) {
        if (values != null) {
            values.forEach(value -> identifier(field, value));
        }
        return this;
    }

    public Validator positive(String field, long value) {
        if (value <= 0) {
            errors.add(field + " must be positive");
        }
        return this;
    }

    public Validator maxLength(String field, String value, int max) {
        if (value != null && value.length() > max) {
            errors.add(field + " must be at most " + max + " characters");
        }
        return this;
    }

    /** Adds an error when {@code condition} is false. */
    public Validator require(boolean condition, String error) {
        if (!condition) {
            errors.add(error);
        }
        return this;
    }

    public ValidationResult result() {
        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }
}
