package com.keystone.container.config;

import java.util.Locale;
import java.util.Optional;

/**
 * Deployment environment a container runs in, detected from the {@code environment} key.
 */
public enum Environment {

    DEVELOPMENT("development"),
    STAGING("staging"),
    PRODUCTION("production"),
    TESTING("testing");

    private final String value;

    Environment(String value) {
        this.value = value;
    }

    /** The canonical string representation (e.g., "production"). */
    public String value() {
        return value;
    }

    /**
     * Parses the usual spellings of an environment name ({@code dev}, {@code prod}, {@code stage},
     * {@code test} and the canonical values). Case-insensitive.
     *
     * @param raw the raw configuration value
     * @return the matching environment, or empty if the value is unknown
     */
    public static Optional<Environment> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "dev", "development" -> Optional.of(DEVELOPMENT);
            case "stage", "staging" -> Optional.of(STAGING);
            case "prod", "production" -> Optional.of(PRODUCTION);
            case "test", "testing" -> Optional.of(TESTING);
            default -> Optional.empty();
        };
    }
}
