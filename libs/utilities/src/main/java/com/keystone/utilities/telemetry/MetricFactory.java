package com.keystone.utilities.telemetry;

import com.keystone.utilities.logging.CorrelationContext;
import com.keystone.utilities.logging.CorrelationContextHolder;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates Micrometer meters tagged with the service name and, when a correlation context with a
 * tenant is active, the tenant.
 */
public final class MetricFactory {

    public static final String TAG_SERVICE = "service";
    public static final String TAG_TENANT = "tenant";

    private final MeterRegistry registry;
    private final String serviceName;

    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * A counter. Meters are cached by the registry, so repeated calls with the same name and tags
     * return the same counter.
     *
     * @param tags additional tags as key-value pairs
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name).description(description).tags(tags(tags)).register(registry);
    }

    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name).description(description).tags(tags(tags)).register(registry);
    }

    /**
     * Registers a gauge and returns its backing value. The registry keeps only a weak reference,
     * so the caller must hold on to the returned value.
     */
    public AtomicLong gauge(String name, String description, String... tags) {
        AtomicLong value = new AtomicLong();
        Gauge.builder(name, value, AtomicLong::doubleValue)
                .description(description)
                .tags(tags(tags))
                .register(registry);
        return value;
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Tags tags(String... extra) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        String tenant = CorrelationContextHolder.get().map(CorrelationContext::tenantId).orElse(null);
        if (tenant != null) {
            tags = tags.and(TAG_TENANT, tenant);
        }
        return extra.length > 0 ? tags.and(extra) : tags;
    }
}
