package com.keystone.utilities.validation;

import com.keystone.container.bootstrap.UtilityDescriptor;
import com.keystone.container.config.ConfigKey;
import com.keystone.container.config.ConfigSlice;
import com.keystone.container.config.ConfigType;
import com.keystone.utilities.UtilityNames;
import java.util.regex.Pattern;

/**
 * Shared input validation. Rules return a {@link ValidationResult} listing every error rather
 * than throwing on the first.
 */
public final class ValidationUtility {

    public static final String IDENTIFIER_PATTERN_KEY = "validation.identifier.pattern";
    public static final String DEFAULT_IDENTIFIER_PATTERN = "[a-z0-9][a-z0-9_.-]{0,63}";

    private final Pattern identifierPattern;

    public ValidationUtility(String identifierPattern) {
        if (identifierPattern == null || identifierPattern.isBlank()) {
            throw new IllegalArgumentException("identifierPattern must not be null or blank");
        }
        this.identifierPattern = Pattern.compile(identifierPattern);
    }

    public ValidationUtility() {
        this(DEFAULT_IDENTIFIER_PATTERN);
    }

    static ValidationUtility fromConfig(ConfigSlice config) {
        return new ValidationUtility(config.getString(IDENTIFIER_PATTERN_KEY, DEFAULT_IDENTIFIER_PATTERN));
    }

    /** Standard descriptor: depends on config and logger. */
    public static UtilityDescriptor descriptor() {
        return UtilityDescriptor.of(UtilityNames.VALIDATION, ctx -> fromConfig(ctx.config()))
                .dependsOn(UtilityNames.CONFIG, UtilityNames.LOGGER)
                .reads(ConfigKey.optional(IDENTIFIER_PATTERN_KEY, ConfigType.STRING, DEFAULT_IDENTIFIER_PATTERN));
    }

    /** Starts collecting rule failures. */
    public Validator check() {
        return new Validator(identifierPattern);
    }

    public boolean isIdentifier(String value) {
        return value != null && identifierPattern.matcher(value).matches();
    }

    public ValidationResult validateIdentifier(String field, String value) {
        return check().identifier(field, value).result();
    }
}
