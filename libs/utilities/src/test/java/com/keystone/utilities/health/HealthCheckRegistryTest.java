package com.keystone.utilities.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("HealthCheckRegistry")
class HealthCheckRegistryTest {

    private final HealthCheckRegistry registry = new HealthCheckRegistry(Duration.ofMillis(200));

    private static HealthCheck fixed(ComponentHealth health) {
        return () -> CompletableFuture.completedFuture(health);
    }

    @Nested
    @DisplayName("Aggregation")
    class Aggregation {

        @Test
        @DisplayName("should be healthy with no checks")
        void shouldBeHealthyWhenEmpty() {
            assertThat(registry.checkAll().status()).isEqualTo(HealthStatus.HEALTHY);
        }

        @Test
        @DisplayName("should report the worst component status")
        void shouldReportWorst() {
            registry.register("cache", fixed(ComponentHealth.healthy("cache", 1)));
            registry.register("exporter", fixed(ComponentHealth.degraded("exporter", "slow", 1)));

            assertThat(registry.checkAll().status()).isEqualTo(HealthStatus.DEGRADED);

            registry.register("store", fixed(ComponentHealth.unhealthy("store", "down", 1)));

            HealthResult result = registry.checkAll();
            assertThat(result.status()).isEqualTo(HealthStatus.UNHEALTHY);
            assertThat(result.checks()).containsOnlyKeys("cache", "exporter", "store");
        }

        @Test
        @DisplayName("should count a slow check as unhealthy")
        void shouldTimeOutSlowChecks() {
            registry.register("slow", CompletableFuture::new);

            HealthResult result = registry.checkAll();

            assertThat(result.status()).isEqualTo(HealthStatus.UNHEALTHY);
            assertThat(result.checks().get("slow").message()).startsWith("Timeout or error");
        }

        @Test
        @DisplayName("should count a throwing check as unhealthy")
        void shouldContainThrowingChecks() {
            registry.register("broken", () -> {
                throw new IllegalStateException("check crashed");
            });
            registry.register("cache", fixed(ComponentHealth.healthy("cache", 1)));

            HealthResult result = registry.checkAll();

            assertThat(result.checks().get("broken").status()).isEqualTo(HealthStatus.UNHEALTHY);
            assertThat(result.checks().get("cache").status()).isEqualTo(HealthStatus.HEALTHY);
        }
    }

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("should replace and deregister checks by name")
        void shouldReplaceAndDeregister() {
            registry.register("store", fixed(ComponentHealth.healthy("store", 1)));
            registry.register("store", fixed(ComponentHealth.unhealthy("store", "down", 1)));

            assertThat(registry.size()).isEqualTo(1);
            assertThat(registry.checkAll().status()).isEqualTo(HealthStatus.UNHEALTHY);
            assertThat(registry.deregister("store")).isTrue();
            assertThat(registry.deregister("store")).isFalse();
        }

        @Test
        @DisplayName("should reject invalid arguments")
        void shouldRejectInvalid() {
            assertThatThrownBy(() -> registry.register(" ", fixed(ComponentHealth.healthy("x", 0))))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> registry.register("x", null)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new HealthCheckRegistry(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
