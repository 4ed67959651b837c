package com.keystone.utilities.health;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs registered {@link HealthCheck}s concurrently and folds them into one {@link HealthResult}.
 * A check that throws, fails or exceeds the timeout counts as UNHEALTHY.
 */
public final class HealthCheckRegistry {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final Map<String, HealthCheck> checks = new ConcurrentHashMap<>();
    private final Duration timeout;

    public HealthCheckRegistry() {
        this(DEFAULT_TIMEOUT);
    }

    public HealthCheckRegistry(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.timeout = timeout;
    }

    /** Registers a check, replacing any existing one with the same name. */
    public void register(String name, HealthCheck check) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        checks.put(name, check);
    }

    public boolean deregister(String name) {
        return checks.remove(name) != null;
    }

    /**
     * Runs every check. With no checks registered the result is HEALTHY.
     */
    public HealthResult checkAll() {
        Map<String, CompletableFuture<ComponentHealth>> running = new LinkedHashMap<>();
        checks.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(entry -> running.put(entry.getKey(), start(entry.getKey(), entry.getValue())));

        Map<String, ComponentHealth> results = new LinkedHashMap<>();
        HealthStatus overall = HealthStatus.HEALTHY;
        for (Map.Entry<String, CompletableFuture<ComponentHealth>> entry : running.entrySet()) {
            String name = entry.getKey();
            ComponentHealth health;
            try {
                health = entry.getValue().orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS).join();
            } catch (RuntimeException e) {
                log.warn("Health check '{}' failed or timed out: {}", name, e.getMessage());
                health = ComponentHealth.unhealthy(name, "Timeout or error: " + e.getMessage(), timeout.toMillis());
            }
            results.put(name, health);
            overall = overall.worst(health.status());
        }
        return new HealthResult(overall, results, Instant.now());
    }

    public int size() {
        return checks.size();
    }

    public Duration timeout() {
        return timeout;
    }

    private static CompletableFuture<ComponentHealth> start(String name, HealthCheck check) {
        try {
            CompletableFuture<ComponentHealth> future = check.check();
            return future != null ? future
                    : CompletableFuture.failedFuture(new IllegalStateException("check returned no result"));
        } catch (RuntimeException e) {
            log.warn("Health check '{}' threw", name, e);
            return CompletableFuture.failedFuture(e);
        }
    }
}
