package com.keystone.utilities.health;

import com.keystone.container.bootstrap.BootstrapAware;
import com.keystone.container.bootstrap.BootstrapResult;
import com.keystone.container.bootstrap.UtilityDescriptor;
import com.keystone.container.bootstrap.UtilityState;
import com.keystone.container.config.ConfigKey;
import com.keystone.container.config.ConfigSlice;
import com.keystone.container.config.ConfigType;
import com.keystone.utilities.UtilityNames;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The {@code health} utility. Aggregates registered health checks and, once bootstrap finishes,
 * one check per container utility: a failed critical utility makes the service UNHEALTHY, any
 * other failed utility makes it DEGRADED.
 */
public final class HealthUtility implements BootstrapAware {

    private static final Logger log = LoggerFactory.getLogger(HealthUtility.class);

    public static final String CHECK_TIMEOUT_KEY = "health.check.timeout";
    public static final String CRITICAL_UTILITIES_KEY = "health.critical.utilities";
    public static final String UTILITY_CHECK_PREFIX = "utility:";

    private final String serviceName;
    private final HealthCheckRegistry registry;
    private final Set<String> critical;
    private volatile Map<String, UtilityState> utilityStates = Map.of();

    public HealthUtility(String serviceName, Duration checkTimeout, Set<String> criticalUtilities) {
        this.serviceName = serviceName;
        this.registry = new HealthCheckRegistry(checkTimeout);
        this.critical = Set.copyOf(criticalUtilities);
    }

    static HealthUtility fromConfig(String serviceName, ConfigSlice config) {
        return new HealthUtility(serviceName,
                config.getDuration(CHECK_TIMEOUT_KEY, HealthCheckRegistry.DEFAULT_TIMEOUT),
                Set.copyOf(config.getList(CRITICAL_UTILITIES_KEY)));
    }

    /** Standard descriptor: depends on config and logger. */
    public static UtilityDescriptor descriptor() {
        return UtilityDescriptor.of(UtilityNames.HEALTH, ctx -> fromConfig(ctx.serviceName(), ctx.config()))
                .dependsOn(UtilityNames.CONFIG, UtilityNames.LOGGER)
                .reads(ConfigKey.optional(CHECK_TIMEOUT_KEY, ConfigType.DURATION, "PT5S"),
                        ConfigKey.optional(CRITICAL_UTILITIES_KEY, ConfigType.LIST,
                                UtilityNames.CONFIG + "," + UtilityNames.LOGGER));
    }

    @Override
    public void onBootstrapComplete(BootstrapResult result) {
        updateUtilityStates(result.states());
    }

    /**
     * Replaces the per-utility checks with the given states. Also usable as a state-listener
     * sink.
     */
    public void updateUtilityStates(Map<String, UtilityState> states) {
        utilityStates.keySet().forEach(name -> registry.deregister(UTILITY_CHECK_PREFIX + name));
        utilityStates = Collections.unmodifiableMap(new LinkedHashMap<>(states));
        states.forEach((name, state) -> registry.register(UTILITY_CHECK_PREFIX + name, () ->
                CompletableFuture.completedFuture(toComponentHealth(name, state))));
        long failed = states.values().stream().filter(UtilityState::isFailed).count();
        if (failed > 0) {
            log.warn("Service '{}' has {} failed utilities", serviceName, failed);
        }
    }

    public void register(String component, HealthCheck check) {
        registry.register(component, check);
    }

    public boolean deregister(String component) {
        return registry.deregister(component);
    }

    public HealthResult checkAll() {
        return registry.checkAll();
    }

    /** Utility states as last reported by bootstrap. */
    public Map<String, UtilityState> utilityStates() {
        return utilityStates;
    }

    public List<String> failedUtilities() {
        return utilityStates.entrySet().stream()
                .filter(e -> e.getValue().isFailed())
                .map(Map.Entry::getKey)
                .toList();
    }

    public String serviceName() {
        return serviceName;
    }

    private ComponentHealth toComponentHealth(String name, UtilityState state) {
        String component = UTILITY_CHECK_PREFIX + name;
        if (state.isReady()) {
            return ComponentHealth.healthy(component, 0);
        }
        String message = state + (state.detail() != null ? ": " + state.detail() : "");
        return critical.contains(name)
                ? ComponentHealth.unhealthy(component, message, 0)
                : ComponentHealth.degraded(component, message, 0);
    }
}
