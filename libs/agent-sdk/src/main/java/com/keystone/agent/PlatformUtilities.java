package com.keystone.agent;

import com.keystone.container.DIContainer;
import com.keystone.container.bootstrap.UtilityDescriptor;
import com.keystone.container.bootstrap.UtilityFactory;
import com.keystone.tenancy.TenantException;
import com.keystone.tenancy.TenantManagementUtility;
import com.keystone.tenancy.store.TenantStore;
import com.keystone.utilities.UtilityNames;
import com.keystone.utilities.config.ConfigUtility;
import com.keystone.utilities.error.ErrorHandlerUtility;
import com.keystone.utilities.error.ErrorSeverity;
import com.keystone.utilities.health.HealthUtility;
import com.keystone.utilities.logging.LoggingUtility;
import com.keystone.utilities.security.SecurityUtility;
import com.keystone.utilities.serialization.SerializationUtility;
import com.keystone.utilities.telemetry.TelemetryUtility;
import com.keystone.utilities.validation.ValidationUtility;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * The standard utility catalog every agent service bootstraps: config, logger, health,
 * error_handler, validation, serialization, telemetry, security and tenant.
 * <p>
 * Dependency graph:
 * <pre>
 * config
 *   logger                          (config)
 *     health, validation,
 *     serialization, telemetry,
 *     security                      (config, logger)
 *     error_handler                 (logger)
 *       tenant                      (config, logger, validation, security)
 * </pre>
 * A failed telemetry exporter therefore leaves tenancy and the rest of the catalog serving.
 */
public final class PlatformUtilities {

    private PlatformUtilities() {
        // utility class
    }

    public static List<UtilityDescriptor> standard() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** A container builder pre-loaded with the standard catalog. */
    public static DIContainer.Builder container(String serviceName) {
        return DIContainer.builder(serviceName).utilities(standard());
    }

    /** Classifies tenancy errors as {@code TENANT_<KIND>}. */
    public static ErrorHandlerUtility registerTenantErrors(ErrorHandlerUtility errors) {
        errors.register(TenantException.class, e -> "TENANT_" + e.kind(), ErrorSeverity.LOW);
        return errors;
    }

    public static final class Builder {

        private final Map<String, UtilityDescriptor> descriptors = new LinkedHashMap<>();

        private Builder() {
            put(ConfigUtility.descriptor());
            put(LoggingUtility.descriptor());
            put(HealthUtility.descriptor());
            put(ErrorHandlerUtility.descriptor()
                    .withFactory(ctx -> registerTenantErrors(new ErrorHandlerUtility())));
            put(ValidationUtility.descriptor());
            put(SerializationUtility.descriptor());
            put(TelemetryUtility.descriptor());
            put(SecurityUtility.descriptor());
            put(TenantManagementUtility.descriptor());
        }

        /**
         * Replaces the factory of a catalog utility, keeping its dependencies and config keys.
         *
         * @throws IllegalArgumentException if the catalog has no such utility
         */
        public Builder override(String name, UtilityFactory factory) {
            UtilityDescriptor current = descriptors.get(name);
            if (current == null) {
                throw new IllegalArgumentException("No standard utility named '" + name + "'");
            }
            descriptors.put(name, current.withFactory(factory));
            return this;
        }

        /** Backs the tenant utility with another store. */
        public Builder tenantStore(Supplier<? extends TenantStore> stores) {
            descriptors.put(UtilityNames.TENANT, TenantManagementUtility.descriptor(stores));
            return this;
        }

        /** Sends telemetry to the given exporter and meter registry. */
        public Builder telemetry(SpanExporter exporter, MeterRegistry meterRegistry) {
            descriptors.put(UtilityNames.TELEMETRY, TelemetryUtility.descriptor(exporter, meterRegistry));
            return this;
        }

        /** Adds a service-specific utility, or replaces a catalog entry of the same name. */
        public Builder add(UtilityDescriptor descriptor) {
            put(descriptor);
            return this;
        }

        public List<UtilityDescriptor> build() {
            return List.copyOf(new ArrayList<>(descriptors.values()));
        }

        private void put(UtilityDescriptor descriptor) {
            descriptors.put(descriptor.name(), descriptor);
        }
    }
}
