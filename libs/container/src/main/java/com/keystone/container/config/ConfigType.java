package com.keystone.container.config;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Declared type of a configuration key. Raw values are always strings; {@link #coerce(String)}
 * converts them and rejects values that do not fit.
 */
public enum ConfigType {

    STRING,
    INT,
    LONG,
    DOUBLE,
    BOOLEAN,

    /** Comma-separated list; blank items are dropped. */
    LIST,

    /** ISO-8601 duration ({@code PT5S}) or a plain number of milliseconds. */
    DURATION;

    private static final Set<String> TRUE_VALUES = Set.of("true", "1", "yes", "on", "enabled");
    private static final Set<String> FALSE_VALUES = Set.of("false", "0", "no", "off", "disabled");

    /**
     * Converts a raw string to this type.
     *
     * @param raw the raw value (never null)
     * @return the converted value
     * @throws IllegalArgumentException if the value cannot be represented as this type
     */
    public Object coerce(String raw) {
        String value = raw.trim();
        try {
            return switch (this) {
                case STRING -> raw;
                case INT -> Integer.parseInt(value);
                case LONG -> Long.parseLong(value);
                case DOUBLE -> Double.parseDouble(value);
                case BOOLEAN -> parseBoolean(value);
                case LIST -> value.isEmpty()
                        ? List.of()
                        : Arrays.stream(value.split(","))
                                .map(String::trim)
                                .filter(item -> !item.isEmpty())
                                .toList();
                case DURATION -> parseDuration(value);
            };
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new IllegalArgumentException(
                    "'%s' is not a valid %s".formatted(raw, name().toLowerCase(Locale.ROOT)), e);
        }
    }

    private static Boolean parseBoolean(String value) {
        String normalized = value.toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(normalized)) {
            return Boolean.TRUE;
        }
        if (FALSE_VALUES.contains(normalized)) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("'%s' is not a valid boolean".formatted(value));
    }

    private static Duration parseDuration(String value) {
        if (!value.isEmpty() && value.chars().allMatch(Character::isDigit)) {
            return Duration.ofMillis(Long.parseLong(value));
        }
        return Duration.parse(value);
    }
}
