package com.keystone.container.config;

/**
 * Configuration layers in ascending precedence. A value from a later layer replaces the value
 * of an earlier one for the same key.
 */
public enum ConfigLayer {

    /** Built-in defaults shipped with the container. */
    DEFAULTS,

    /** Values provided by the infrastructure environment. */
    ENVIRONMENT,

    /** Values from the secret store. */
    SECRETS,

    /** Explicit overrides passed to {@code initialize}. */
    OVERRIDES
}
