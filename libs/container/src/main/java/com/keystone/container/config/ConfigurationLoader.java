package com.keystone.container.config;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves configuration from layered sources into a single {@link ConfigurationSnapshot}.
 * <p>
 * Layers are applied in {@link ConfigLayer} order: built-in defaults, infrastructure environment,
 * secret store, explicit overrides. A later layer wins on key collision, except that a blank value
 * never replaces a non-blank one from an earlier layer. Loading has no side effects beyond the
 * returned snapshot.
 */
public final class ConfigurationLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationLoader.class);

    /** Key holding the deployment environment name. */
    public static final String ENVIRONMENT_KEY = "environment";

    /** Environment variable naming a {@code KEY=value} secrets file. */
    public static final String SECRETS_FILE_VARIABLE = "KEYSTONE_SECRETS_FILE";

    /** Defaults applied below every other layer. */
    public static final Map<String, String> BUILT_IN_DEFAULTS = Map.of(
            ENVIRONMENT_KEY, Environment.DEVELOPMENT.value());

    private final ConfigSource defaults;
    private final ConfigSource environment;
    private final ConfigSource secrets;

    /**
     * Creates a loader over explicit sources for the three lower layers.
     */
    public ConfigurationLoader(ConfigSource defaults, ConfigSource environment, ConfigSource secrets) {
        if (defaults == null || environment == null || secrets == null) {
            throw new IllegalArgumentException("config sources must not be null");
        }
        this.defaults = defaults;
        this.environment = environment;
        this.secrets = secrets;
    }

    /**
     * The loader used in deployed services: built-in defaults, {@code KEYSTONE_*} environment
     * variables, and the secrets file named by {@value #SECRETS_FILE_VARIABLE} if set.
     */
    public static ConfigurationLoader standard() {
        String secretsFile = System.getenv(SECRETS_FILE_VARIABLE);
        ConfigSource secrets = secretsFile == null || secretsFile.isBlank()
                ? ConfigSource.empty()
                : ConfigSource.envFile(Path.of(secretsFile));
        return new ConfigurationLoader(ConfigSource.of(BUILT_IN_DEFAULTS), ConfigSource.environment(), secrets);
    }

    /**
     * A loader that only sees built-in defaults and the given fixed values as its environment
     * layer. Useful for tests and for embedding.
     */
    public static ConfigurationLoader fixed(Map<String, String> environmentValues) {
        return new ConfigurationLoader(
                ConfigSource.of(BUILT_IN_DEFAULTS), ConfigSource.of(environmentValues), ConfigSource.empty());
    }

    /**
     * Loads a snapshot for the given service.
     *
     * @param serviceName logical service name
     * @param overrides   explicit overrides, highest precedence (may be null)
     */
    public ConfigurationSnapshot load(String serviceName, Map<String, String> overrides) {
        return load(serviceName, overrides, List.of());
    }

    /**
     * Loads a snapshot and validates container-wide keys against it.
     *
     * @throws ConfigException if a required key is missing or a value does not fit its type
     */
    public ConfigurationSnapshot load(String serviceName, Map<String, String> overrides,
                                      Collection<ConfigKey> requiredKeys) {
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        Map<ConfigLayer, Map<String, String>> layers = new EnumMap<>(ConfigLayer.class);
        layers.put(ConfigLayer.DEFAULTS, defaults.read());
        layers.put(ConfigLayer.ENVIRONMENT, environment.read());
        layers.put(ConfigLayer.SECRETS, secrets.read());
        layers.put(ConfigLayer.OVERRIDES, overrides == null ? Map.of() : overrides);

        Map<String, String> values = new LinkedHashMap<>();
        Map<String, ConfigLayer> origins = new LinkedHashMap<>();
        for (Map.Entry<ConfigLayer, Map<String, String>> layer : layers.entrySet()) {
            layer.getValue().forEach((key, value) -> {
                if (value == null) {
                    return;
                }
                String existing = values.get(key);
                if (value.isBlank() && existing != null && !existing.isBlank()) {
                    return;
                }
                values.put(key, value);
                origins.put(key, layer.getKey());
            });
        }

        Environment env = detectEnvironment(values.get(ENVIRONMENT_KEY), serviceName);
        ConfigurationSnapshot snapshot =
                new ConfigurationSnapshot(serviceName, env, values, origins, Instant.now());

        if (!requiredKeys.isEmpty()) {
            ConfigSlice.resolve(snapshot, requiredKeys);
        }

        log.info("Loaded {} configuration values for '{}' (environment={}, defaults={}, env={}, secrets={}, overrides={})",
                snapshot.size(), serviceName, env.value(),
                layers.get(ConfigLayer.DEFAULTS).size(), layers.get(ConfigLayer.ENVIRONMENT).size(),
                layers.get(ConfigLayer.SECRETS).size(), layers.get(ConfigLayer.OVERRIDES).size());
        return snapshot;
    }

    /**
     * Resolves the typed slice for one utility's declared keys.
     *
     * @throws ConfigException if a required key is missing or a value does not fit its type
     */
    public ConfigSlice slice(ConfigurationSnapshot snapshot, Collection<ConfigKey> keys) {
        return ConfigSlice.resolve(snapshot, keys);
    }

    private static Environment detectEnvironment(String raw, String serviceName) {
        return Environment.parse(raw).orElseGet(() -> {
            log.warn("Unknown environment '{}' for '{}', defaulting to {}",
                    raw, serviceName, Environment.DEVELOPMENT.value());
            return Environment.DEVELOPMENT;
        });
    }
}
