package com.keystone.utilities.health;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate of every registered check.
 *
 * @param status    worst component status
 * @param checks    component results keyed by component name
 * @param timestamp when the checks ran
 */
public record HealthResult(HealthStatus status, Map<String, ComponentHealth> checks, Instant timestamp) {

    public HealthResult {
        checks = Collections.unmodifiableMap(new LinkedHashMap<>(checks));
    }
}
