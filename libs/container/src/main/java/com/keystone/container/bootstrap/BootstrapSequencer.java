package com.keystone.container.bootstrap;

import com.keystone.container.config.ConfigException;
import com.keystone.container.config.ConfigSlice;
import com.keystone.container.config.ConfigurationSnapshot;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Constructs utilities in dependency order and records the final state of each.
 * <p>
 * A failing utility never aborts the run: it is marked FAILED, everything that depends on it
 * (directly or transitively) is marked {@link FailureKind#DEPENDENCY_FAILED}, and independent
 * branches carry on. Each factory runs on a bootstrap worker thread and is awaited for at most
 * the remaining deadline; once the deadline passes the running utility and all pending ones
 * become {@link FailureKind#TIMEOUT}.
 */
public final class BootstrapSequencer {

    private static final Logger log = LoggerFactory.getLogger(BootstrapSequencer.class);

    private final List<UtilityStateListener> listeners;

    public BootstrapSequencer() {
        this(List.of());
    }

    public BootstrapSequencer(List<UtilityStateListener> listeners) {
        this.listeners = List.copyOf(listeners);
    }

    /**
     * Bootstraps the given utilities against one configuration snapshot.
     *
     * @throws BootstrapException if the dependency graph is invalid or cyclic; nothing is
     *                            constructed in that case
     */
    public BootstrapResult bootstrap(List<UtilityDescriptor> descriptors, ConfigurationSnapshot snapshot,
                                     Duration deadline) {
        if (deadline == null || deadline.isNegative() || deadline.isZero()) {
            throw new IllegalArgumentException("deadline must be positive");
        }
        String serviceName = snapshot.serviceName();
        List<String> order = DependencyGraph.order(descriptors);

        Map<String, UtilityDescriptor> byName = new HashMap<>();
        descriptors.forEach(d -> byName.put(d.name(), d));

        long startNanos = System.nanoTime();
        long deadlineNanos = startNanos + deadline.toNanos();
        Map<String, UtilityState> states = new LinkedHashMap<>();
        order.forEach(name -> transition(states, serviceName, name, UtilityState.PENDING));

        UtilityRegistry registry = new UtilityRegistry();
        ExecutorService worker = Executors.newSingleThreadExecutor(
                WorkerThreads.daemon("keystone-bootstrap-" + serviceName));
        boolean timedOut = false;
        try {
            for (String name : order) {
                UtilityDescriptor descriptor = byName.get(name);
                if (timedOut) {
                    transition(states, serviceName, name,
                            UtilityState.failed(FailureKind.TIMEOUT, "bootstrap deadline exceeded"));
                    continue;
                }

                String unavailable = descriptor.dependencies().stream()
                        .filter(dependency -> !states.get(dependency).isReady())
                        .findFirst()
                        .orElse(null);
                if (unavailable != null) {
                    transition(states, serviceName, name, UtilityState.failed(FailureKind.DEPENDENCY_FAILED,
                            "dependency '%s' is %s".formatted(unavailable, states.get(unavailable))));
                    continue;
                }

                ConfigSlice slice;
                try {
                    slice = ConfigSlice.resolve(snapshot, descriptor.configKeys());
                } catch (ConfigException e) {
                    FailureKind kind = e.kind() == ConfigException.Kind.TYPE_MISMATCH
                            ? FailureKind.TYPE_MISMATCH
                            : FailureKind.MISSING_REQUIRED;
                    log.warn("Utility '{}' of '{}' has invalid configuration: {}", name, serviceName, e.getMessage());
                    transition(states, serviceName, name, UtilityState.failed(kind, e.getMessage()));
                    continue;
                }

                Map<String, Object> dependencies = new LinkedHashMap<>();
                descriptor.dependencies().forEach(dependency ->
                        dependencies.put(dependency, registry.get(dependency).orElseThrow()));
                UtilityContext context = new UtilityContext(serviceName, slice, dependencies,
                        descriptor.fullSnapshot() ? snapshot : null);

                transition(states, serviceName, name, UtilityState.INITIALIZING);
                long remaining = deadlineNanos - System.nanoTime();
                if (remaining <= 0) {
                    timedOut = true;
                    transition(states, serviceName, name,
                            UtilityState.failed(FailureKind.TIMEOUT, "bootstrap deadline exceeded"));
                    continue;
                }

                Handoff handoff = new Handoff();
                Future<Object> construction = worker.submit(() -> {
                    Object created = descriptor.factory().create(context);
                    if (!handoff.deliver(created)) {
                        closeAbandoned(serviceName, name, created);
                    }
                    return created;
                });
                try {
                    Object instance = construction.get(remaining, TimeUnit.NANOSECONDS);
                    if (instance == null) {
                        transition(states, serviceName, name,
                                UtilityState.failed(FailureKind.CONSTRUCTION_FAILED, "factory returned null"));
                    } else {
                        registry.register(name, instance);
                        transition(states, serviceName, name, UtilityState.READY);
                    }
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.warn("Utility '{}' of '{}' failed to construct", name, serviceName, cause);
                    transition(states, serviceName, name,
                            UtilityState.failed(FailureKind.CONSTRUCTION_FAILED, describe(cause)));
                } catch (TimeoutException e) {
                    construction.cancel(true);
                    closeAbandoned(serviceName, name, handoff.abandon());
                    timedOut = true;
                    log.warn("Utility '{}' of '{}' did not finish before the bootstrap deadline of {}",
                            name, serviceName, deadline);
                    transition(states, serviceName, name,
                            UtilityState.failed(FailureKind.TIMEOUT, "construction exceeded " + deadline));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    construction.cancel(true);
                    closeAbandoned(serviceName, name, handoff.abandon());
                    timedOut = true;
                    transition(states, serviceName, name,
                            UtilityState.failed(FailureKind.TIMEOUT, "bootstrap interrupted"));
                }
            }
        } finally {
            worker.shutdownNow();
        }

        registry.freeze();
        BootstrapResult result = new BootstrapResult(serviceName, states, registry, order,
                Duration.ofNanos(System.nanoTime() - startNanos));
        if (result.isDegraded()) {
            log.warn("Bootstrap of '{}' finished degraded in {} ms: failed={}",
                    serviceName, result.elapsed().toMillis(), result.failed());
        } else {
            log.info("Bootstrap of '{}' finished in {} ms with {} utilities ready",
                    serviceName, result.elapsed().toMillis(), registry.size());
        }
        notifyBootstrapAware(result);
        return result;
    }

    private void transition(Map<String, UtilityState> states, String serviceName, String name, UtilityState state) {
        states.put(name, state);
        log.debug("Utility '{}' of '{}' -> {}", name, serviceName, state);
        for (UtilityStateListener listener : listeners) {
            try {
                listener.onTransition(serviceName, name, state);
            } catch (RuntimeException e) {
                log.warn("State listener failed for utility '{}' of '{}'", name, serviceName, e);
            }
        }
    }

    private static void notifyBootstrapAware(BootstrapResult result) {
        for (String name : result.registry().names()) {
            Object instance = result.registry().get(name).orElseThrow();
            if (instance instanceof BootstrapAware aware) {
                try {
                    aware.onBootstrapComplete(result);
                } catch (RuntimeException e) {
                    log.warn("Utility '{}' of '{}' failed to process the bootstrap result",
                            name, result.serviceName(), e);
                }
            }
        }
    }

    /**
     * Closes an instance whose construction finished after the sequencer stopped waiting for it.
     * Such an instance never reaches the registry, so nothing else would release it.
     */
    private static void closeAbandoned(String serviceName, String name, Object instance) {
        if (!(instance instanceof AutoCloseable closeable)) {
            return;
        }
        log.info("Closing late instance of utility '{}' of '{}'", name, serviceName);
        try {
            closeable.close();
        } catch (Exception e) {
            log.warn("Failed to close late instance of utility '{}' of '{}'", name, serviceName, e);
        }
    }

    /** Hands a constructed instance from the worker to the sequencer unless the sequencer gave up. */
    private static final class Handoff {
        private Object delivered;
        private boolean abandoned;

        synchronized boolean deliver(Object instance) {
            if (abandoned) {
                return false;
            }
            delivered = instance;
            return true;
        }

        synchronized Object abandon() {
            abandoned = true;
            return delivered;
        }
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null
                ? cause.getClass().getSimpleName() + ": " + cause.getMessage()
                : cause.getClass().getSimpleName();
    }
}
