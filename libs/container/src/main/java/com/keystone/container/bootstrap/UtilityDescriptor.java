package com.keystone.container.bootstrap;

import com.keystone.container.config.ConfigKey;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Declares one utility: its registry name, how to build it, which utilities it needs and which
 * configuration keys it reads.
 *
 * @param name         registry name (e.g., "logger", "tenant")
 * @param factory      constructor function
 * @param dependencies names of utilities that must be ready first, in declaration order
 * @param configKeys   configuration keys resolved into the utility's slice
 * @param fullSnapshot whether the factory also sees the whole configuration snapshot
 */
public record UtilityDescriptor(
        String name,
        UtilityFactory factory,
        List<String> dependencies,
        List<ConfigKey> configKeys,
        boolean fullSnapshot
) {

    public UtilityDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory must not be null");
        }
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        configKeys = configKeys == null ? List.of() : List.copyOf(configKeys);
    }

    /** A descriptor with no dependencies and no configuration keys. */
    public static UtilityDescriptor of(String name, UtilityFactory factory) {
        return new UtilityDescriptor(name, factory, List.of(), List.of(), false);
    }

    /** Returns a copy with the given dependencies appended. */
    public UtilityDescriptor dependsOn(String... names) {
        List<String> merged = new ArrayList<>(dependencies);
        merged.addAll(Arrays.asList(names));
        return new UtilityDescriptor(name, factory, merged, configKeys, fullSnapshot);
    }

    /** Returns a copy with the given configuration keys appended. */
    public UtilityDescriptor reads(ConfigKey... keys) {
        List<ConfigKey> merged = new ArrayList<>(configKeys);
        merged.addAll(Arrays.asList(keys));
        return new UtilityDescriptor(name, factory, dependencies, merged, fullSnapshot);
    }

    /** Returns a copy built by a different factory. */
    public UtilityDescriptor withFactory(UtilityFactory replacement) {
        return new UtilityDescriptor(name, replacement, dependencies, configKeys, fullSnapshot);
    }

    /** Returns a copy whose factory is handed the whole configuration snapshot. */
    public UtilityDescriptor readsFullSnapshot() {
        return new UtilityDescriptor(name, factory, dependencies, configKeys, true);
    }
}
