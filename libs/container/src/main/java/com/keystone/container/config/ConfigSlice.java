package com.keystone.container.config;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed view over the configuration keys one utility declared. Only declared keys are visible.
 */
public final class ConfigSlice {

    private static final ConfigSlice EMPTY = new ConfigSlice(Map.of());

    private final Map<String, Object> values;

    private ConfigSlice(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /** A slice with no keys. */
    public static ConfigSlice empty() {
        return EMPTY;
    }

    /**
     * Resolves the given keys against a snapshot. Absent optional keys fall back to their default;
     * absent optional keys without a default are left out of the slice.
     *
     * @throws ConfigException {@code MISSING_REQUIRED} or {@code TYPE_MISMATCH}
     */
    public static ConfigSlice resolve(ConfigurationSnapshot snapshot, Collection<ConfigKey> keys) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (ConfigKey key : keys) {
            String raw = snapshot.get(key.name())
                    .filter(value -> !value.isBlank())
                    .orElse(key.defaultValue());
            if (raw == null) {
                if (key.required()) {
                    throw ConfigException.missingRequired(key.name());
                }
                continue;
            }
            try {
                resolved.put(key.name(), key.type().coerce(raw));
            } catch (IllegalArgumentException e) {
                throw ConfigException.typeMismatch(key.name(), key.type(), e);
            }
        }
        return new ConfigSlice(resolved);
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public Optional<String> getString(String key) {
        return Optional.ofNullable((String) values.get(key));
    }

    public String getString(String key, String fallback) {
        return getString(key).orElse(fallback);
    }

    public int getInt(String key, int fallback) {
        Object value = values.get(key);
        return value != null ? (Integer) value : fallback;
    }

    public long getLong(String key, long fallback) {
        Object value = values.get(key);
        return value != null ? (Long) value : fallback;
    }

    public double getDouble(String key, double fallback) {
        Object value = values.get(key);
        return value != null ? (Double) value : fallback;
    }

    public boolean getBoolean(String key, boolean fallback) {
        Object value = values.get(key);
        return value != null ? (Boolean) value : fallback;
    }

    @SuppressWarnings("unchecked")
    public List<String> getList(String key) {
        Object value = values.get(key);
        return value != null ? (List<String>) value : List.of();
    }

    public Duration getDuration(String key, Duration fallback) {
        Object value = values.get(key);
        return value != null ? (Duration) value : fallback;
    }

    /** Key names present in this slice. */
    public Collection<String> keys() {
        return values.keySet();
    }

    public int size() {
        return values.size();
    }
}
