package com.keystone.container.bootstrap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DependencyGraph")
class DependencyGraphTest {

    private static UtilityDescriptor utility(String name, String... dependencies) {
        return UtilityDescriptor.of(name, ctx -> name).dependsOn(dependencies);
    }

    @Nested
    @DisplayName("Ordering")
    class Ordering {

        @Test
        @DisplayName("should place every utility after its dependencies")
        void shouldRespectDependencies() {
            List<String> order = DependencyGraph.order(List.of(
                    utility("tenant", "config", "security"),
                    utility("security", "config"),
                    utility("config")));

            assertThat(order).containsExactly("config", "security", "tenant");
        }

        @Test
        @DisplayName("should keep declaration order among independent utilities")
        void shouldBeStable() {
            List<String> order = DependencyGraph.order(List.of(
                    utility("config"),
                    utility("logger", "config"),
                    utility("health", "logger"),
                    utility("telemetry", "config"),
                    utility("validation", "logger")));

            assertThat(order).containsExactly("config", "logger", "health", "telemetry", "validation");
        }

        @Test
        @DisplayName("should return an empty order for no utilities")
        void shouldHandleEmpty() {
            assertThat(DependencyGraph.order(List.of())).isEmpty();
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("should name the members of a cycle and leave out utilities merely downstream of it")
        void shouldNameCycleMembers() {
            assertThatThrownBy(() -> DependencyGraph.order(List.of(
                    utility("config"),
                    utility("a", "c"),
                    utility("b", "a"),
                    utility("c", "b", "config"),
                    utility("d", "a"))))
                    .isInstanceOf(BootstrapException.class)
                    .satisfies(e -> {
                        BootstrapException be = (BootstrapException) e;
                        assertThat(be.kind()).isEqualTo(BootstrapException.Kind.CYCLIC_DEPENDENCY);
                        assertThat(be.utilities()).containsExactlyInAnyOrder("a", "b", "c");
                    });
        }

        @Test
        @DisplayName("should treat a self-dependency as a cycle")
        void shouldDetectSelfDependency() {
            assertThatThrownBy(() -> DependencyGraph.order(List.of(utility("loop", "loop"))))
                    .isInstanceOf(BootstrapException.class)
                    .extracting(e -> ((BootstrapException) e).kind())
                    .isEqualTo(BootstrapException.Kind.CYCLIC_DEPENDENCY);
        }

        @Test
        @DisplayName("should reject duplicate names")
        void shouldRejectDuplicates() {
            assertThatThrownBy(() -> DependencyGraph.order(List.of(utility("config"), utility("config"))))
                    .isInstanceOf(BootstrapException.class)
                    .extracting(e -> ((BootstrapException) e).kind())
                    .isEqualTo(BootstrapException.Kind.INVALID_GRAPH);
        }

        @Test
        @DisplayName("should reject dependencies on undeclared utilities")
        void shouldRejectUnknownDependencies() {
            assertThatThrownBy(() -> DependencyGraph.order(List.of(utility("logger", "config"))))
                    .isInstanceOf(BootstrapException.class)
                    .hasMessageContaining("logger -> config")
                    .extracting(e -> ((BootstrapException) e).kind())
                    .isEqualTo(BootstrapException.Kind.INVALID_GRAPH);
        }
    }
}
