package com.keystone.container.config;

/**
 * A configuration key a utility reads, with its declared type.
 *
 * @param name         key name (e.g., "telemetry.sample.ratio")
 * @param type         declared type the raw value must coerce to
 * @param required     whether the key must be present in some layer
 * @param defaultValue raw fallback used when the key is absent (null for none)
 */
public record ConfigKey(String name, ConfigType type, boolean required, String defaultValue) {

    public ConfigKey {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
    }

    /** A key that must be supplied by some configuration layer. */
    public static ConfigKey required(String name, ConfigType type) {
        return new ConfigKey(name, type, true, null);
    }

    /** A key with a fallback value used when no layer supplies it. */
    public static ConfigKey optional(String name, ConfigType type, String defaultValue) {
        return new ConfigKey(name, type, false, defaultValue);
    }

    /** A key that may be absent altogether. */
    public static ConfigKey optional(String name, ConfigType type) {
        return new ConfigKey(name, type, false, null);
    }
}
