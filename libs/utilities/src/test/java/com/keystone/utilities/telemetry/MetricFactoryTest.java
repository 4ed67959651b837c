package com.keystone.utilities.telemetry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.keystone.utilities.logging.CorrelationContext;
import com.keystone.utilities.logging.CorrelationContextHolder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MetricFactory")
class MetricFactoryTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MetricFactory metrics = new MetricFactory(registry, "orders");

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("should tag meters with the service")
    void shouldTagService() {
        metrics.counter("keystone.requests", "Requests", "capability", "quote").increment();

        assertThat(registry.get("keystone.requests").tag("service", "orders").tag("capability", "quote")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should tag meters with the active tenant")
    void shouldTagTenant() {
        CorrelationContextHolder.set(CorrelationContext.forService("orders").withTenant("acme"));

        metrics.counter("keystone.requests", "Requests").increment();
        metrics.timer("keystone.latency", "Latency").record(java.time.Duration.ofMillis(5));

        assertThat(registry.get("keystone.requests").tag("tenant", "acme").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("keystone.latency").tag("tenant", "acme").timer().count()).isEqualTo(1L);
    }

    @Test
    @DisplayName("should back gauges with the returned value")
    void shouldBackGauges() {
        var value = metrics.gauge("keystone.tenants.active", "Active tenants");
        value.set(3);

        assertThat(registry.get("keystone.tenants.active").gauge().value()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("should reject invalid construction arguments")
    void shouldRejectInvalid() {
        assertThatThrownBy(() -> new MetricFactory(null, "orders")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MetricFactory(registry, " ")).isInstanceOf(IllegalArgumentException.class);
    }
}
