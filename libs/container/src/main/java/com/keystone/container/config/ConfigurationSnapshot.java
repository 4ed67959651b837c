package com.keystone.container.config;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable result of one configuration load. A container holds exactly one snapshot per
 * generation; replacing configuration means loading a new snapshot and re-initializing.
 *
 * @param serviceName logical service the snapshot was loaded for
 * @param environment detected deployment environment
 * @param values      resolved key-value pairs
 * @param origins     layer each key was resolved from
 * @param loadedAt    when the snapshot was produced
 */
public record ConfigurationSnapshot(
        String serviceName,
        Environment environment,
        Map<String, String> values,
        Map<String, ConfigLayer> origins,
        Instant loadedAt
) {

    public ConfigurationSnapshot {
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        if (environment == null) {
            throw new IllegalArgumentException("environment must not be null");
        }
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        origins = Collections.unmodifiableMap(new LinkedHashMap<>(origins));
    }

    /** Returns the raw value for a key, if any layer supplied it. */
    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /** Returns the layer that supplied a key, if present. */
    public Optional<ConfigLayer> origin(String key) {
        return Optional.ofNullable(origins.get(key));
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public int size() {
        return values.size();
    }
}
