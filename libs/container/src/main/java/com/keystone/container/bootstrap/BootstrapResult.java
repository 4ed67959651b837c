package com.keystone.container.bootstrap;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one bootstrap run.
 *
 * @param serviceName owning service
 * @param states      final state per utility, in construction order
 * @param registry    frozen registry holding only ready utilities
 * @param order       construction order
 * @param elapsed     wall-clock time the run took
 */
public record BootstrapResult(
        String serviceName,
        Map<String, UtilityState> states,
        UtilityRegistry registry,
        List<String> order,
        Duration elapsed
) {

    public BootstrapResult {
        states = Collections.unmodifiableMap(new LinkedHashMap<>(states));
        order = List.copyOf(order);
    }

    /** Failed utilities and their states. */
    public Map<String, UtilityState> failed() {
        Map<String, UtilityState> failed = new LinkedHashMap<>();
        states.forEach((name, state) -> {
            if (state.isFailed()) {
                failed.put(name, state);
            }
        });
        return failed;
    }

    /** True when at least one utility failed. */
    public boolean isDegraded() {
        return states.values().stream().anyMatch(UtilityState::isFailed);
    }

    /** True when every declared utility is ready. */
    public boolean isFullyReady() {
        return states.values().stream().allMatch(UtilityState::isReady);
    }

    public UtilityState state(String utilityName) {
        return states.get(utilityName);
    }
}
