package com.keystone.container.bootstrap;

import com.keystone.container.config.ConfigSlice;
import com.keystone.container.config.ConfigurationSnapshot;
import java.util.Map;

/**
 * What a {@link UtilityFactory} receives: the owning service, its configuration slice and the
 * handles of its declared dependencies, all of which are ready.
 *
 * @param serviceName  logical service the container belongs to
 * @param config       typed values of the keys the utility declared
 * @param dependencies ready dependency instances keyed by utility name
 * @param snapshot     whole configuration snapshot, only for descriptors that asked for it
 */
public record UtilityContext(
        String serviceName,
        ConfigSlice config,
        Map<String, Object> dependencies,
        ConfigurationSnapshot snapshot
) {

    public UtilityContext {
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        config = config == null ? ConfigSlice.empty() : config;
        dependencies = dependencies == null ? Map.of() : Map.copyOf(dependencies);
    }

    /**
     * Returns a declared dependency as the given type.
     *
     * @throws IllegalArgumentException if the utility did not declare it or it has another type
     */
    public <T> T dependency(String name, Class<T> type) {
        Object instance = dependencies.get(name);
        if (instance == null) {
            throw new IllegalArgumentException("'%s' is not a declared dependency".formatted(name));
        }
        if (!type.isInstance(instance)) {
            throw new IllegalArgumentException("Dependency '%s' is a %s, not a %s"
                    .formatted(name, instance.getClass().getName(), type.getName()));
        }
        return type.cast(instance);
    }

    /**
     * Returns the whole configuration snapshot.
     *
     * @throws IllegalStateException unless the descriptor was declared with
     *                               {@link UtilityDescriptor#readsFullSnapshot()}
     */
    public ConfigurationSnapshot fullSnapshot() {
        if (snapshot == null) {
            throw new IllegalStateException("utility did not declare access to the full snapshot");
        }
        return snapshot;
    }
}
