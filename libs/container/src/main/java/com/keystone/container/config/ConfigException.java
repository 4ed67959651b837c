package com.keystone.container.config;

import java.nio.file.Path;

/**
 * Thrown when configuration cannot satisfy a declared key.
 */
public class ConfigException extends RuntimeException {

    /** Kind of configuration failure. */
    public enum Kind {

        /** A required key is absent from every layer. */
        MISSING_REQUIRED,

        /** A value cannot be coerced to the key's declared type. */
        TYPE_MISMATCH,

        /** A configuration source exists but cannot be read. */
        SOURCE_UNREADABLE
    }

    private final Kind kind;
    private final String key;

    public ConfigException(Kind kind, String key, String message) {
        super(message);
        this.kind = kind;
        this.key = key;
    }

    public ConfigException(Kind kind, String key, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.key = key;
    }

    /** Creates a {@link Kind#MISSING_REQUIRED} failure for the given key. */
    public static ConfigException missingRequired(String key) {
        return new ConfigException(Kind.MISSING_REQUIRED, key,
                "Required configuration key '%s' is not set".formatted(key));
    }

    /** Creates a {@link Kind#TYPE_MISMATCH} failure for the given key. */
    public static ConfigException typeMismatch(String key, ConfigType type, Throwable cause) {
        return new ConfigException(Kind.TYPE_MISMATCH, key,
                "Configuration key '%s' cannot be read as %s: %s".formatted(key, type, cause.getMessage()),
                cause);
    }

    /** Creates a {@link Kind#SOURCE_UNREADABLE} failure for a file layer; the key is the file path. */
    public static ConfigException unreadableSource(Path file, Throwable cause) {
        return new ConfigException(Kind.SOURCE_UNREADABLE, file.toString(),
                "Configuration file %s cannot be read: %s".formatted(file, cause.getMessage()), cause);
    }

    public Kind kind() {
        return kind;
    }

    public String key() {
        return key;
    }
}
