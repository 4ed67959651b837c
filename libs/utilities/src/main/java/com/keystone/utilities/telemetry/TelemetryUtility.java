package com.keystone.utilities.telemetry;

import com.keystone.container.bootstrap.BootstrapAware;
import com.keystone.container.bootstrap.BootstrapResult;
import com.keystone.container.bootstrap.UtilityDescriptor;
import com.keystone.container.config.ConfigKey;
import com.keystone.container.config.ConfigSlice;
import com.keystone.container.config.ConfigType;
import com.keystone.utilities.UtilityNames;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.TracerProvider;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.SdkTracerProviderBuilder;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import io.opentelemetry.sdk.trace.samplers.Sampler;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The {@code telemetry} utility: an OpenTelemetry tracer owned by this container, plus
 * Micrometer metrics. Span export is fire-and-forget; exporter failures never reach callers.
 * Closing the utility flushes and shuts down the tracer provider.
 */
public final class TelemetryUtility implements AutoCloseable, BootstrapAware {

    private static final Logger log = LoggerFactory.getLogger(TelemetryUtility.class);

    public static final String ENABLED_KEY = "telemetry.enabled";
    public static final String SAMPLE_RATIO_KEY = "telemetry.sample.ratio";
    public static final String INSTRUMENTATION_NAME = "com.keystone";

    private final String serviceName;
    private final SdkTracerProvider tracerProvider;
    private final SpanHelper spans;
    private final MetricFactory metrics;
    private final AtomicLong failedUtilities;

    /**
     * @param serviceName  owning service, exported as {@code service.name}
     * @param enabled      when false spans are not recorded
     * @param sampleRatio  fraction of traces to sample, in [0, 1]
     * @param exporter     span exporter (null for none)
     * @param meterRegistry registry for metrics (null for an in-memory one)
     */
    public TelemetryUtility(String serviceName, boolean enabled, double sampleRatio,
                            SpanExporter exporter, MeterRegistry meterRegistry) {
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        if (Double.isNaN(sampleRatio) || sampleRatio < 0.0 || sampleRatio > 1.0) {
            throw new IllegalArgumentException("sample ratio must be within [0, 1], was " + sampleRatio);
        }
        this.serviceName = serviceName;

        SdkTracerProviderBuilder builder = SdkTracerProvider.builder()
                .setResource(Resource.getDefault().merge(
                        Resource.create(Attributes.of(AttributeKey.stringKey("service.name"), serviceName))))
                .setSampler(enabled ? Sampler.traceIdRatioBased(sampleRatio) : Sampler.alwaysOff());
        if (exporter != null) {
            builder.addSpanProcessor(SimpleSpanProcessor.create(exporter));
        }
        this.tracerProvider = builder.build();
        this.spans = new SpanHelper(tracerProvider.get(INSTRUMENTATION_NAME));
        this.metrics = new MetricFactory(meterRegistry != null ? meterRegistry : new SimpleMeterRegistry(), serviceName);
        this.failedUtilities = metrics.gauge("keystone.utilities.failed", "Utilities that failed to bootstrap");
        log.info("Telemetry for '{}' started (enabled={}, sampleRatio={}, exporter={})",
                serviceName, enabled, sampleRatio, exporter != null ? exporter.getClass().getSimpleName() : "none");
    }

    static TelemetryUtility fromConfig(String serviceName, ConfigSlice config, SpanExporter exporter,
                                       MeterRegistry meterRegistry) {
        return new TelemetryUtility(serviceName,
                config.getBoolean(ENABLED_KEY, true),
                config.getDouble(SAMPLE_RATIO_KEY, 1.0),
                exporter, meterRegistry);
    }

    /** Standard descriptor without span export and with an in-memory meter registry. */
    public static UtilityDescriptor descriptor() {
        return descriptor(null, null);
    }

    /** Standard descriptor: depends on config and logger. */
    public static UtilityDescriptor descriptor(SpanExporter exporter, MeterRegistry meterRegistry) {
        return UtilityDescriptor.of(UtilityNames.TELEMETRY,
                        ctx -> fromConfig(ctx.serviceName(), ctx.config(), exporter, meterRegistry))
                .dependsOn(UtilityNames.CONFIG, UtilityNames.LOGGER)
                .reads(ConfigKey.optional(ENABLED_KEY, ConfigType.BOOLEAN, "true"),
                        ConfigKey.optional(SAMPLE_RATIO_KEY, ConfigType.DOUBLE, "1.0"));
    }

    @Override
    public void onBootstrapComplete(BootstrapResult result) {
        failedUtilities.set(result.failed().size());
        metrics.counter("keystone.bootstrap.completed", "Bootstrap runs completed",
                "degraded", Boolean.toString(result.isDegraded())).increment();
    }

    public SpanHelper spans() {
        return spans;
    }

    public MetricFactory metrics() {
        return metrics;
    }

    public TracerProvider tracerProvider() {
        return tracerProvider;
    }

    public String serviceName() {
        return serviceName;
    }

    @Override
    public void close() {
        CompletableResultCode result = tracerProvider.shutdown().join(5, TimeUnit.SECONDS);
        if (!result.isSuccess()) {
            log.warn("Telemetry for '{}' did not shut down cleanly", serviceName);
        }
    }
}
