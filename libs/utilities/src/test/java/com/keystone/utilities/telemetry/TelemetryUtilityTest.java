package com.keystone.utilities.telemetry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.keystone.container.bootstrap.BootstrapSequencer;
import com.keystone.container.bootstrap.FailureKind;
import com.keystone.container.bootstrap.UtilityDescriptor;
import com.keystone.container.config.ConfigurationLoader;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TelemetryUtility")
class TelemetryUtilityTest {

    private final InMemorySpanExporter exporter = InMemorySpanExporter.create();
    private final SimpleMeterRegistry meters = new SimpleMeterRegistry();

    @Test
    @DisplayName("should export spans to the configured exporter")
    void shouldExportSpans() {
        try (var telemetry = new TelemetryUtility("orders", true, 1.0, exporter, meters)) {
            telemetry.spans().inSpan("tenant.create", () -> "ok");
        }

        assertThat(exporter.getFinishedSpanItems()).hasSize(1);
        assertThat(exporter.getFinishedSpanItems().get(0).getResource().getAttribute(
                io.opentelemetry.api.common.AttributeKey.stringKey("service.name"))).isEqualTo("orders");
    }

    @Test
    @DisplayName("should record nothing when disabled")
    void shouldRecordNothingWhenDisabled() {
        try (var telemetry = new TelemetryUtility("orders", false, 1.0, exporter, meters)) {
            telemetry.spans().inSpan("tenant.create", () -> "ok");
        }

        assertThat(exporter.getFinishedSpanItems()).isEmpty();
    }

    @Test
    @DisplayName("should reject a sample ratio outside [0, 1]")
    void shouldRejectBadRatio() {
        assertThatThrownBy(() -> new TelemetryUtility("orders", true, 1.5, exporter, meters))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sample ratio");
    }

    @Test
    @DisplayName("should fail its own construction for an out-of-range configured ratio")
    void shouldFailConstructionFromConfig() {
        var snapshot = ConfigurationLoader.fixed(Map.of("telemetry.sample.ratio", "2.0")).load("orders", Map.of());
        List<UtilityDescriptor> descriptors = List.of(
                UtilityDescriptor.of("config", ctx -> "config"),
                UtilityDescriptor.of("logger", ctx -> "logger"),
                TelemetryUtility.descriptor(exporter, meters));

        var result = new BootstrapSequencer().bootstrap(descriptors, snapshot, Duration.ofSeconds(5));

        assertThat(result.state("telemetry").failureKind()).isEqualTo(FailureKind.CONSTRUCTION_FAILED);
        assertThat(result.state("logger").isReady()).isTrue();
    }

    @Test
    @DisplayName("should publish bootstrap outcome metrics")
    void shouldPublishBootstrapMetrics() {
        var snapshot = ConfigurationLoader.fixed(Map.of()).load("orders", Map.of());
        var result = new BootstrapSequencer().bootstrap(List.of(
                UtilityDescriptor.of("config", ctx -> "config"),
                UtilityDescriptor.of("logger", ctx -> "logger"),
                UtilityDescriptor.of("cache", ctx -> {
                    throw new IllegalStateException("down");
                }),
                TelemetryUtility.descriptor(exporter, meters)), snapshot, Duration.ofSeconds(5));

        assertThat(result.state("telemetry").isReady()).isTrue();
        assertThat(meters.get("keystone.utilities.failed").gauge().value()).isEqualTo(1.0);
        assertThat(meters.get("keystone.bootstrap.completed").tag("degraded", "true").counter().count())
                .isEqualTo(1.0);
        ((TelemetryUtility) result.registry().get("telemetry").orElseThrow()).close();
    }
}
