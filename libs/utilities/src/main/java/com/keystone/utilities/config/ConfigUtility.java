package com.keystone.utilities.config;

import com.keystone.container.bootstrap.UtilityDescriptor;
import com.keystone.container.config.ConfigException;
import com.keystone.container.config.ConfigKey;
import com.keystone.container.config.ConfigType;
import com.keystone.container.config.ConfigurationSnapshot;
import com.keystone.container.config.Environment;
import com.keystone.utilities.UtilityNames;
import com.keystone.utilities.validation.ValidationResult;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The {@code config} utility: typed, read-only access to the container's configuration snapshot.
 * <p>
 * Getters with a fallback return it when the key is absent or blank; a present value that does
 * not fit the requested type throws {@link ConfigException} with kind TYPE_MISMATCH.
 */
public final class ConfigUtility {

    private final ConfigurationSnapshot snapshot;

    public ConfigUtility(ConfigurationSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot must not be null");
        }
        this.snapshot = snapshot;
    }

    /** Standard descriptor: the root of the utility graph. */
    public static UtilityDescriptor descriptor() {
        return UtilityDescriptor.of(UtilityNames.CONFIG, ctx -> new ConfigUtility(ctx.fullSnapshot()))
                .readsFullSnapshot();
    }

    public Optional<String> getString(String key) {
        return snapshot.get(key).filter(value -> !value.isBlank());
    }

    public String getString(String key, String fallback) {
        return getString(key).orElse(fallback);
    }

    public int getInt(String key, int fallback) {
        return (Integer) coerce(key, ConfigType.INT).orElse(fallback);
    }

    public long getLong(String key, long fallback) {
        return (Long) coerce(key, ConfigType.LONG).orElse(fallback);
    }

    public double getDouble(String key, double fallback) {
        return (Double) coerce(key, ConfigType.DOUBLE).orElse(fallback);
    }

    public boolean getBoolean(String key, boolean fallback) {
        return (Boolean) coerce(key, ConfigType.BOOLEAN).orElse(fallback);
    }

    @SuppressWarnings("unchecked")
    public List<String> getList(String key) {
        return (List<String>) coerce(key, ConfigType.LIST).orElse(List.of());
    }

    public Duration getDuration(String key, Duration fallback) {
        return (Duration) coerce(key, ConfigType.DURATION).orElse(fallback);
    }

    /**
     * Returns a value that must be present.
     *
     * @throws ConfigException MISSING_REQUIRED if no layer set it
     */
    public String require(String key) {
        return getString(key).orElseThrow(() -> ConfigException.missingRequired(key));
    }

    /**
     * Checks a set of keys without throwing, reporting every missing or mistyped key.
     */
    public ValidationResult validate(Collection<ConfigKey> keys) {
        List<String> errors = new ArrayList<>();
        for (ConfigKey key : keys) {
            Optional<String> raw = getString(key.name());
            if (raw.isEmpty()) {
                if (key.required() && key.defaultValue() == null) {
                    errors.add("missing required key '%s'".formatted(key.name()));
                }
                continue;
            }
            try {
                key.type().coerce(raw.get());
            } catch (IllegalArgumentException e) {
                errors.add("key '%s': %s".formatted(key.name(), e.getMessage()));
            }
        }
        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    public Environment environment() {
        return snapshot.environment();
    }

    public boolean isProduction() {
        return snapshot.environment() == Environment.PRODUCTION;
    }

    public boolean isDevelopment() {
        return snapshot.environment() == Environment.DEVELOPMENT;
    }

    public String serviceName() {
        return snapshot.serviceName();
    }

    public Set<String> keys() {
        return snapshot.values().keySet();
    }

    public ConfigurationSnapshot snapshot() {
        return snapshot;
    }

    private Optional<Object> coerce(String key, ConfigType type) {
        return getString(key).map(raw -> {
            try {
                return type.coerce(raw);
            } catch (IllegalArgumentException e) {
                throw ConfigException.typeMismatch(key, type, e);
            }
        });
    }
}
