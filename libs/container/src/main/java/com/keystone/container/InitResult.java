package com.keystone.container;

import com.keystone.container.bootstrap.BootstrapResult;
import com.keystone.container.bootstrap.UtilityState;
import com.keystone.container.config.ConfigException;
import com.keystone.container.config.ConfigurationSnapshot;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of {@link DIContainer#initialize(Map)}. Exactly one of {@code bootstrap} and
 * {@code configError} is present.
 *
 * @param generation  generation number, starting at 1
 * @param snapshot    configuration the generation runs on (null when loading failed)
 * @param bootstrap   bootstrap outcome (null when loading failed)
 * @param configError configuration failure that prevented bootstrap (null otherwise)
 * @param states      final state per declared utility
 */
public record InitResult(
        long generation,
        ConfigurationSnapshot snapshot,
        BootstrapResult bootstrap,
        ConfigException configError,
        Map<String, UtilityState> states
) {

    public InitResult {
        if ((bootstrap == null) == (configError == null)) {
            throw new IllegalArgumentException("exactly one of bootstrap and configError must be set");
        }
        states = Collections.unmodifiableMap(new LinkedHashMap<>(states));
    }

    public Optional<ConfigException> configFailure() {
        return Optional.ofNullable(configError);
    }

    public boolean isFullyReady() {
        return bootstrap != null && bootstrap.isFullyReady();
    }

    public boolean isDegraded() {
        return !isFullyReady();
    }
}
