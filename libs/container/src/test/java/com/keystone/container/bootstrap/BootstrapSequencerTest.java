package com.keystone.container.bootstrap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.keystone.container.config.ConfigKey;
import com.keystone.container.config.ConfigType;
import com.keystone.container.config.ConfigurationLoader;
import com.keystone.container.config.ConfigurationSnapshot;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("BootstrapSequencer")
class BootstrapSequencerTest {

    private static final Duration DEADLINE = Duration.ofSeconds(5);

    private final ConfigurationSnapshot snapshot =
            ConfigurationLoader.fixed(Map.of("telemetry.sample.ratio", "lots")).load("svc", Map.of());
    private final BootstrapSequencer sequencer = new BootstrapSequencer();

    private static UtilityDescriptor ok(String name, String... dependencies) {
        return UtilityDescriptor.of(name, ctx -> name + "-instance").dependsOn(dependencies);
    }

    private static UtilityDescriptor failing(String name, String... dependencies) {
        return UtilityDescriptor.of(name, ctx -> {
            throw new IllegalStateException(name + " exporter unreachable");
        }).dependsOn(dependencies);
    }

    @Nested
    @DisplayName("Partial failure")
    class PartialFailure {

        @Test
        @DisplayName("should fail dependents of a failed utility and keep independent branches ready")
        void shouldContainFailureToSubtree() {
            BootstrapResult result = sequencer.bootstrap(List.of(
                    ok("config"),
                    failing("a", "config"),
                    ok("b", "a"),
                    ok("b2", "b"),
                    ok("c", "config")), snapshot, DEADLINE);

            assertThat(result.state("a").failureKind()).isEqualTo(FailureKind.CONSTRUCTION_FAILED);
            assertThat(result.state("a").detail()).contains("exporter unreachable");
            assertThat(result.state("b").failureKind()).isEqualTo(FailureKind.DEPENDENCY_FAILED);
            assertThat(result.state("b2").failureKind()).isEqualTo(FailureKind.DEPENDENCY_FAILED);
            assertThat(result.state("c").isReady()).isTrue();
            assertThat(result.registry().names()).containsExactly("config", "c");
            assertThat(result.isDegraded()).isTrue();
            assertThat(result.failed()).containsOnlyKeys("a", "b", "b2");
        }

        @Test
        @DisplayName("should never mark a utility ready unless all of its dependencies are ready")
        void shouldKeepReadyClosedUnderDependencies() {
            List<UtilityDescriptor> descriptors = List.of(
                    ok("config"),
                    ok("logger", "config"),
                    failing("telemetry", "config", "logger"),
                    ok("health", "logger", "telemetry"),
                    ok("security", "config", "logger"),
                    ok("tenant", "security", "logger"));

            BootstrapResult result = sequencer.bootstrap(descriptors, snapshot, DEADLINE);

            for (UtilityDescriptor descriptor : descriptors) {
                if (result.state(descriptor.name()).isReady()) {
                    assertThat(descriptor.dependencies())
                            .allSatisfy(dep -> assertThat(result.state(dep).isReady()).isTrue());
                }
            }
            assertThat(result.state("tenant").isReady()).isTrue();
            assertThat(result.state("health").isFailed()).isTrue();
        }

        @Test
        @DisplayName("should treat a null instance as a construction failure")
        void shouldRejectNullInstance() {
            BootstrapResult result = sequencer.bootstrap(
                    List.of(UtilityDescriptor.of("empty", ctx -> null)), snapshot, DEADLINE);

            assertThat(result.state("empty").failureKind()).isEqualTo(FailureKind.CONSTRUCTION_FAILED);
        }

        @Test
        @DisplayName("should fail only the utility whose configuration does not coerce")
        void shouldContainConfigFailure() {
            BootstrapResult result = sequencer.bootstrap(List.of(
                    ok("config"),
                    ok("telemetry", "config").reads(ConfigKey.required("telemetry.sample.ratio", ConfigType.DOUBLE)),
                    ok("security", "config").reads(ConfigKey.required("security.issuer", ConfigType.STRING)),
                    ok("logger", "config")), snapshot, DEADLINE);

            assertThat(result.state("telemetry").failureKind()).isEqualTo(FailureKind.TYPE_MISMATCH);
            assertThat(result.state("security").failureKind()).isEqualTo(FailureKind.MISSING_REQUIRED);
            assertThat(result.state("logger").isReady()).isTrue();
        }
    }

    @Nested
    @DisplayName("Construction context")
    class Context {

        @Test
        @DisplayName("should hand each factory only its declared dependencies and its own slice")
        void shouldPassDeclaredDependenciesOnly() {
            AtomicReference<UtilityContext> seen = new AtomicReference<>();
            var snapshot = ConfigurationLoader.fixed(Map.of("tenant.max.users", "25", "other", "x"))
                    .load("svc", Map.of());

            sequencer.bootstrap(List.of(
                    ok("config"),
                    ok("logger"),
                    UtilityDescriptor.of("tenant", ctx -> {
                        seen.set(ctx);
                        return "tenant";
                    }).dependsOn("config").reads(ConfigKey.optional("tenant.max.users", ConfigType.INT, "10"))),
                    snapshot, DEADLINE);

            UtilityContext context = seen.get();
            assertThat(context.serviceName()).isEqualTo("svc");
            assertThat(context.dependencies()).containsOnlyKeys("config");
            assertThat(context.dependency("config", String.class)).isEqualTo("config-instance");
            assertThat(context.config().getInt("tenant.max.users", 0)).isEqualTo(25);
            assertThat(context.config().contains("other")).isFalse();
            assertThatThrownBy(() -> context.dependency("logger", String.class))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should hand the whole snapshot only to utilities that declare it")
        void shouldGuardFullSnapshot() {
            AtomicReference<UtilityContext> config = new AtomicReference<>();
            AtomicReference<UtilityContext> logger = new AtomicReference<>();

            sequencer.bootstrap(List.of(
                    UtilityDescriptor.of("config", ctx -> {
                        config.set(ctx);
                        return "config";
                    }).readsFullSnapshot(),
                    UtilityDescriptor.of("logger", ctx -> {
                        logger.set(ctx);
                        return "logger";
                    })), snapshot, DEADLINE);

            assertThat(config.get().fullSnapshot()).isSameAs(snapshot);
            assertThatThrownBy(() -> logger.get().fullSnapshot()).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("should construct in topological order")
        void shouldConstructInOrder() {
            List<String> names = new ArrayList<>();
            sequencer.bootstrap(List.of(
                    UtilityDescriptor.of("logger", ctx -> names.add("logger")).dependsOn("config"),
                    UtilityDescriptor.of("config", ctx -> names.add("config"))), snapshot, DEADLINE);

            assertThat(names).containsExactly("config", "logger");
        }
    }

    @Nested
    @DisplayName("Graph errors")
    class GraphErrors {

        @Test
        @DisplayName("should construct nothing when the graph has a cycle")
        void shouldConstructNothingOnCycle() {
            AtomicInteger constructed = new AtomicInteger();
            UtilityFactory counting = ctx -> constructed.incrementAndGet();

            assertThatThrownBy(() -> sequencer.bootstrap(List.of(
                    UtilityDescriptor.of("config", counting),
                    UtilityDescriptor.of("a", counting).dependsOn("b"),
                    UtilityDescriptor.of("b", counting).dependsOn("a")), snapshot, DEADLINE))
                    .isInstanceOf(BootstrapException.class)
                    .extracting(e -> ((BootstrapException) e).kind())
                    .isEqualTo(BootstrapException.Kind.CYCLIC_DEPENDENCY);
            assertThat(constructed).hasValue(0);
        }
    }

    @Nested
    @DisplayName("Deadline")
    class Deadline {

        @Test
        @DisplayName("should mark the running and all pending utilities as timed out")
        void shouldMarkRemainingAsTimedOut() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            long start = System.nanoTime();

            BootstrapResult result = sequencer.bootstrap(List.of(
                    ok("config"),
                    UtilityDescriptor.of("slow", ctx -> {
                        release.await(10, TimeUnit.SECONDS);
                        return "slow";
                    }),
                    ok("logger", "config")), snapshot, Duration.ofMillis(200));

            release.countDown();
            assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(5));
            assertThat(result.state("config").isReady()).isTrue();
            assertThat(result.state("slow").failureKind()).isEqualTo(FailureKind.TIMEOUT);
            assertThat(result.state("logger").failureKind()).isEqualTo(FailureKind.TIMEOUT);
        }

        @Test
        @DisplayName("should close an instance whose factory finishes after the deadline")
        void shouldCloseLateInstance() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            CountDownLatch closed = new CountDownLatch(1);

            BootstrapResult result = sequencer.bootstrap(List.of(
                    UtilityDescriptor.of("stubborn", ctx -> {
                        awaitIgnoringInterrupts(release);
                        AutoCloseable connection = closed::countDown;
                        return connection;
                    })), snapshot, Duration.ofMillis(200));

            assertThat(result.state("stubborn").failureKind()).isEqualTo(FailureKind.TIMEOUT);
            assertThat(result.registry().contains("stubborn")).isFalse();

            release.countDown();
            assertThat(closed.await(5, TimeUnit.SECONDS)).isTrue();
        }

        private void awaitIgnoringInterrupts(CountDownLatch latch) {
            boolean interrupted = false;
            while (true) {
                try {
                    if (latch.await(10, TimeUnit.SECONDS)) {
                        break;
                    }
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Nested
    @DisplayName("Notifications")
    class Notifications {

        @Test
        @DisplayName("should report every transition to listeners")
        void shouldNotifyListeners() {
            List<String> events = new CopyOnWriteArrayList<>();
            var listening = new BootstrapSequencer(List.of(
                    (service, utility, state) -> events.add(utility + ":" + state)));

            listening.bootstrap(List.of(ok("config"), failing("telemetry", "config")), snapshot, DEADLINE);

            assertThat(events).containsExactly(
                    "config:PENDING", "telemetry:PENDING",
                    "config:INITIALIZING", "config:READY",
                    "telemetry:INITIALIZING", "telemetry:FAILED(CONSTRUCTION_FAILED)");
        }

        @Test
        @DisplayName("should tell bootstrap-aware utilities the final result")
        void shouldNotifyBootstrapAware() {
            AtomicReference<BootstrapResult> received = new AtomicReference<>();
            BootstrapAware aware = received::set;

            BootstrapResult result = sequencer.bootstrap(List.of(
                    UtilityDescriptor.of("health", ctx -> aware),
                    failing("telemetry")), snapshot, DEADLINE);

            assertThat(received.get()).isSameAs(result);
            assertThat(received.get().failed()).containsOnlyKeys("telemetry");
        }

        @Test
        @DisplayName("should survive a listener that throws")
        void shouldSurviveFailingListener() {
            var listening = new BootstrapSequencer(List.of((service, utility, state) -> {
                throw new IllegalStateException("sink down");
            }));

            BootstrapResult result = listening.bootstrap(List.of(ok("config")), snapshot, DEADLINE);

            assertThat(result.isFullyReady()).isTrue();
        }
    }
}
