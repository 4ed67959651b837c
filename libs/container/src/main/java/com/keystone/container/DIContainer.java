package com.keystone.container;

import com.keystone.container.bootstrap.BootstrapException;
import com.keystone.container.bootstrap.BootstrapResult;
import com.keystone.container.bootstrap.BootstrapSequencer;
import com.keystone.container.bootstrap.FailureKind;
import com.keystone.container.bootstrap.UtilityDescriptor;
import com.keystone.container.bootstrap.UtilityRegistry;
import com.keystone.container.bootstrap.UtilityState;
import com.keystone.container.bootstrap.UtilityStateListener;
import com.keystone.container.bootstrap.WorkerThreads;
import com.keystone.container.config.ConfigException;
import com.keystone.container.config.ConfigKey;
import com.keystone.container.config.ConfigurationLoader;
import com.keystone.container.config.ConfigurationSnapshot;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the configuration snapshot and utility registry of one logical service and is the only
 * object application code touches to reach utilities.
 * <p>
 * Containers are plain instances: several may live in one process (one per service, or one per
 * test) without sharing any mutable state. After {@link #initialize(Map)} the registry is frozen
 * and {@link #getUtility(String)} is lock-free. {@link #shutdown()} drains in-flight
 * {@link #withUtility leases} for a grace period and then closes {@link AutoCloseable} utilities
 * in reverse construction order, each within its own time budget.
 */
public final class DIContainer {

    private static final Logger log = LoggerFactory.getLogger(DIContainer.class);

    public static final Duration DEFAULT_INIT_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_SHUTDOWN_GRACE = Duration.ofSeconds(10);
    public static final Duration DEFAULT_TEARDOWN_BUDGET = Duration.ofSeconds(5);

    private final String serviceName;
    private final List<UtilityDescriptor> descriptors;
    private final ConfigurationLoader loader;
    private final List<ConfigKey> requiredKeys;
    private final Duration initTimeout;
    private final Duration shutdownGrace;
    private final Duration teardownBudget;
    private final BootstrapSequencer sequencer;

    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private final Object leaseMonitor = new Object();
    private int activeLeases;
    private boolean acceptingLeases;

    private volatile ContainerLifecycleState lifecycle = ContainerLifecycleState.CREATED;
    private volatile Generation current;
    private long generationCounter;

    private DIContainer(Builder builder) {
        this.serviceName = builder.serviceName;
        this.descriptors = List.copyOf(builder.descriptors);
        this.loader = builder.loader != null ? builder.loader : ConfigurationLoader.standard();
        this.requiredKeys = List.copyOf(builder.requiredKeys);
        this.initTimeout = builder.initTimeout;
        this.shutdownGrace = builder.shutdownGrace;
        this.teardownBudget = builder.teardownBudget;
        this.sequencer = new BootstrapSequencer(builder.listeners);
    }

    /** Starts building a container for the given logical service. */
    public static Builder builder(String serviceName) {
        return new Builder(serviceName);
    }

    /**
     * Loads configuration and bootstraps every declared utility as a new generation. A running
     * generation is torn down first.
     * <p>
     * Configuration failures and failures of individual utilities are reported in the result;
     * the container still runs in degraded mode.
     *
     * @param overrides explicit configuration overrides (may be null)
     * @throws BootstrapException if the dependency graph is invalid or cyclic, or another
     *                            lifecycle operation holds the container past the init timeout
     */
    public InitResult initialize(Map<String, String> overrides) {
        acquireLifecycle();
        try {
            if (current != null) {
                log.info("Re-initializing '{}', tearing down generation {}", serviceName, current.number);
                teardown(current);
                current = null;
            }
            lifecycle = ContainerLifecycleState.INITIALIZING;
            long generation = ++generationCounter;

            ConfigurationSnapshot snapshot;
            try {
                snapshot = loader.load(serviceName, overrides, requiredKeys);
            } catch (ConfigException e) {
                log.error("Configuration for '{}' failed to load: {}", serviceName, e.getMessage());
                FailureKind kind = e.kind() == ConfigException.Kind.TYPE_MISMATCH
                        ? FailureKind.TYPE_MISMATCH
                        : FailureKind.MISSING_REQUIRED;
                Map<String, UtilityState> states = new LinkedHashMap<>();
                descriptors.forEach(d -> states.put(d.name(), UtilityState.failed(kind, e.getMessage())));
                publish(new Generation(generation, null, new UtilityRegistry(), states));
                lifecycle = ContainerLifecycleState.FAILED;
                return new InitResult(generation, null, null, e, states);
            }

            BootstrapResult result;
            try {
                result = sequencer.bootstrap(descriptors, snapshot, initTimeout);
            } catch (BootstrapException e) {
                lifecycle = ContainerLifecycleState.FAILED;
                log.error("Container '{}' cannot bootstrap: {}", serviceName, e.getMessage());
                throw e;
            }
            publish(new Generation(generation, snapshot, result.registry(), result.states()));
            return new InitResult(generation, snapshot, result, null, result.states());
        } finally {
            lifecycleLock.unlock();
        }
    }

    /** Same as {@code initialize(Map.of())}. */
    public InitResult initialize() {
        return initialize(Map.of());
    }

    /**
     * Returns a ready utility.
     *
     * @throws UtilityUnavailableException if the container is not running or the utility is not
     *                                     ready
     */
    public Object getUtility(String name) {
        Generation generation = current;
        if (lifecycle != ContainerLifecycleState.RUNNING || generation == null) {
            throw new UtilityUnavailableException(name, null,
                    "Container '%s' is %s; utility '%s' is unavailable".formatted(serviceName, lifecycle, name));
        }
        return generation.registry.get(name).orElseThrow(() -> {
            UtilityState state = generation.states.get(name);
            String reason = state == null ? "not declared" : state.toString();
            return new UtilityUnavailableException(name, state,
                    "Utility '%s' of '%s' is unavailable (%s)".formatted(name, serviceName, reason));
        });
    }

    /**
     * Returns a ready utility as the given type.
     *
     * @throws UtilityUnavailableException if it is not ready or not of that type
     */
    public <T> T getUtility(String name, Class<T> type) {
        Object instance = getUtility(name);
        if (!type.isInstance(instance)) {
            throw new UtilityUnavailableException(name, UtilityState.READY,
                    "Utility '%s' of '%s' is a %s, not a %s"
                            .formatted(name, serviceName, instance.getClass().getName(), type.getName()));
        }
        return type.cast(instance);
    }

    /** Non-throwing variant of {@link #getUtility(String, Class)} for optional collaborators. */
    public <T> Optional<T> findUtility(String name, Class<T> type) {
        Generation generation = current;
        if (lifecycle != ContainerLifecycleState.RUNNING || generation == null) {
            return Optional.empty();
        }
        return generation.registry.get(name).filter(type::isInstance).map(type::cast);
    }

    /**
     * Runs {@code action} against a utility while holding a lease. Shutdown waits for open
     * leases (up to the grace period) before releasing utilities.
     *
     * @throws UtilityUnavailableException if the container is shutting down or the utility is
     *                                     not ready
     */
    public <T, R> R withUtility(String name, Class<T> type, Function<? super T, ? extends R> action) {
        synchronized (leaseMonitor) {
            if (!acceptingLeases) {
                throw new UtilityUnavailableException(name, null,
                        "Container '%s' is not accepting calls (%s)".formatted(serviceName, lifecycle));
            }
            activeLeases++;
        }
        try {
            return action.apply(getUtility(name, type));
        } finally {
            synchronized (leaseMonitor) {
                activeLeases--;
                leaseMonitor.notifyAll();
            }
        }
    }

    /**
     * Drains in-flight leases, then closes utilities in reverse construction order. Teardown
     * errors and timeouts are logged; this method always completes.
     */
    public void shutdown() {
        acquireLifecycle();
        try {
            if (lifecycle == ContainerLifecycleState.STOPPED) {
                return;
            }
            lifecycle = ContainerLifecycleState.STOPPING;
            Generation generation = current;
            if (generation != null) {
                teardown(generation);
            }
            current = null;
            lifecycle = ContainerLifecycleState.STOPPED;
            log.info("Container '{}' stopped", serviceName);
        } finally {
            lifecycleLock.unlock();
        }
    }

    /** State of every declared utility in the current generation. */
    public Map<String, UtilityState> healthSummary() {
        Generation generation = current;
        return generation == null ? Map.of() : generation.states;
    }

    /** Utilities of the current generation that are not ready. */
    public Map<String, UtilityState> degradedUtilities() {
        Map<String, UtilityState> degraded = new LinkedHashMap<>();
        healthSummary().forEach((name, state) -> {
            if (!state.isReady()) {
                degraded.put(name, state);
            }
        });
        return degraded;
    }

    public ContainerLifecycleState lifecycleState() {
        return lifecycle;
    }

    public Optional<ConfigurationSnapshot> snapshot() {
        Generation generation = current;
        return generation == null ? Optional.empty() : Optional.ofNullable(generation.snapshot);
    }

    /** Current generation number, 0 before the first initialize. */
    public long generation() {
        Generation generation = current;
        return generation == null ? 0 : generation.number;
    }

    public String serviceName() {
        return serviceName;
    }

    public List<UtilityDescriptor> descriptors() {
        return descriptors;
    }

    int activeLeases() {
        synchronized (leaseMonitor) {
            return activeLeases;
        }
    }

    private void acquireLifecycle() {
        try {
            if (!lifecycleLock.tryLock(initTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw BootstrapException.timeout(serviceName,
                        "another lifecycle operation is still running after " + initTimeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw BootstrapException.timeout(serviceName, "interrupted while waiting for the lifecycle lock");
        }
    }

    private void publish(Generation generation) {
        current = generation;
        synchronized (leaseMonitor) {
            acceptingLeases = true;
        }
        lifecycle = ContainerLifecycleState.RUNNING;
    }

    private void teardown(Generation generation) {
        drainLeases();
        List<Map.Entry<String, Object>> entries = generation.registry.release();
        ExecutorService closer = Executors.newCachedThreadPool(
                WorkerThreads.daemon("keystone-teardown-" + serviceName));
        try {
            for (Map.Entry<String, Object> entry : entries) {
                if (entry.getValue() instanceof AutoCloseable closeable) {
                    close(closer, entry.getKey(), closeable);
                }
            }
        } finally {
            closer.shutdownNow();
        }
    }

    private void drainLeases() {
        long deadline = System.nanoTime() + shutdownGrace.toNanos();
        synchronized (leaseMonitor) {
            acceptingLeases = false;
            while (activeLeases > 0) {
                long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMillis <= 0) {
                    log.warn("Container '{}' releasing utilities with {} calls still in flight after {}",
                            serviceName, activeLeases, shutdownGrace);
                    return;
                }
                try {
                    leaseMonitor.wait(remainingMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Container '{}' interrupted while draining {} calls", serviceName, activeLeases);
                    return;
                }
            }
        }
    }

    private void close(ExecutorService closer, String name, AutoCloseable closeable) {
        Future<?> task = closer.submit(() -> {
            closeable.close();
            return null;
        });
        try {
            task.get(teardownBudget.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Utility '{}' of '{}' closed", name, serviceName);
        } catch (ExecutionException e) {
            log.warn("Utility '{}' of '{}' failed to close", name, serviceName, e.getCause());
        } catch (TimeoutException e) {
            task.cancel(true);
            log.warn("Utility '{}' of '{}' did not close within {}", name, serviceName, teardownBudget);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.cancel(true);
            log.warn("Interrupted while closing utility '{}' of '{}'", name, serviceName);
        }
    }

    private static final class Generation {
        private final long number;
        private final ConfigurationSnapshot snapshot;
        private final UtilityRegistry registry;
        private final Map<String, UtilityState> states;

        private Generation(long number, ConfigurationSnapshot snapshot, UtilityRegistry registry,
                           Map<String, UtilityState> states) {
            this.number = number;
            this.snapshot = snapshot;
            this.registry = registry;
            this.states = Collections.unmodifiableMap(new LinkedHashMap<>(states));
        }
    }

    /**
     * Builder for {@link DIContainer}.
     */
    public static final class Builder {

        private final String serviceName;
        private final List<UtilityDescriptor> descriptors = new ArrayList<>();
        private final List<ConfigKey> requiredKeys = new ArrayList<>();
        private final List<UtilityStateListener> listeners = new ArrayList<>();
        private ConfigurationLoader loader;
        private Duration initTimeout = DEFAULT_INIT_TIMEOUT;
        private Duration shutdownGrace = DEFAULT_SHUTDOWN_GRACE;
        private Duration teardownBudget = DEFAULT_TEARDOWN_BUDGET;

        private Builder(String serviceName) {
            if (serviceName == null || serviceName.isBlank()) {
                throw new IllegalArgumentException("serviceName must not be null or blank");
            }
            this.serviceName = serviceName;
        }

        public Builder utility(UtilityDescriptor descriptor) {
            if (descriptor == null) {
                throw new IllegalArgumentException("descriptor must not be null");
            }
            descriptors.add(descriptor);
            return this;
        }

        public Builder utilities(List<UtilityDescriptor> all) {
            all.forEach(this::utility);
            return this;
        }

        public Builder configurationLoader(ConfigurationLoader configurationLoader) {
            this.loader = configurationLoader;
            return this;
        }

        /** Keys validated for the whole container on every load. */
        public Builder requireKey(ConfigKey key) {
            requiredKeys.add(key);
            return this;
        }

        public Builder listener(UtilityStateListener listener) {
            listeners.add(listener);
            return this;
        }

        public Builder initTimeout(Duration timeout) {
            this.initTimeout = positive(timeout, "initTimeout");
            return this;
        }

        public Builder shutdownGrace(Duration grace) {
            if (grace == null || grace.isNegative()) {
                throw new IllegalArgumentException("shutdownGrace must not be negative");
            }
            this.shutdownGrace = grace;
            return this;
        }

        public Builder teardownBudget(Duration budget) {
            this.teardownBudget = positive(budget, "teardownBudget");
            return this;
        }

        public DIContainer build() {
            return new DIContainer(this);
        }

        private static Duration positive(Duration value, String name) {
            if (value == null || value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }
    }
}
