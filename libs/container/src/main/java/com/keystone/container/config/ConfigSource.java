package com.keystone.container.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * A key-value source feeding one configuration layer. Keys and values are plain strings.
 */
@FunctionalInterface
public interface ConfigSource {

    /** Prefix that marks an environment variable as Keystone configuration. */
    String ENV_PREFIX = "KEYSTONE_";

    /**
     * Reads the current contents of this source. Called once per {@code load}.
     *
     * @return key-value pairs (never null)
     */
    Map<String, String> read();

    /** An empty source. */
    static ConfigSource empty() {
        return Map::of;
    }

    /** A fixed in-memory source. */
    static ConfigSource of(Map<String, String> values) {
        Map<String, String> copy = Map.copyOf(values);
        return () -> copy;
    }

    /**
     * Environment variables carrying the {@value #ENV_PREFIX} prefix, with the prefix stripped and
     * the name normalised: {@code KEYSTONE_TELEMETRY_SAMPLE_RATIO} becomes
     * {@code telemetry.sample.ratio}.
     */
    static ConfigSource environment() {
        return environment(System::getenv);
    }

    /**
     * Same as {@link #environment()} but reading from the supplied variables.
     */
    static ConfigSource environment(Supplier<Map<String, String>> variables) {
        return () -> {
            Map<String, String> result = new LinkedHashMap<>();
            variables.get().forEach((name, value) -> {
                if (name.startsWith(ENV_PREFIX) && name.length() > ENV_PREFIX.length()) {
                    result.put(normalize(name.substring(ENV_PREFIX.length())), value);
                }
            });
            return result;
        };
    }

    /**
     * A {@code KEY=value} file such as {@code .env.secrets}. Blank lines and lines starting with
     * {@code #} are skipped; keys are normalised like environment variables. A missing file reads
     * as empty; a file that exists but cannot be read fails with
     * {@link ConfigException.Kind#SOURCE_UNREADABLE}.
     */
    static ConfigSource envFile(Path file) {
        return () -> {
            if (!Files.isRegularFile(file)) {
                return Map.of();
            }
            List<String> lines;
            try {
                lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw ConfigException.unreadableSource(file, e);
            }
            Map<String, String> result = new LinkedHashMap<>();
            for (String line : lines) {
                String trimmed = line.strip();
                int separator = trimmed.indexOf('=');
                if (trimmed.isEmpty() || trimmed.startsWith("#") || separator <= 0) {
                    continue;
                }
                String key = trimmed.substring(0, separator).strip();
                String value = trimmed.substring(separator + 1).strip();
                result.put(normalize(key), value);
            }
            return result;
        };
    }

    /**
     * Normalises an environment-style name to a dotted lower-case key. Names that already contain
     * a dot are only lower-cased.
     */
    static String normalize(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.contains(".") ? lower : lower.replace('_', '.');
    }
}
