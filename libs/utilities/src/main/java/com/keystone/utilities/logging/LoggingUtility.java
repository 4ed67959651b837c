package com.keystone.utilities.logging;

import com.keystone.container.bootstrap.UtilityDescriptor;
import com.keystone.container.config.ConfigKey;
import com.keystone.container.config.ConfigSlice;
import com.keystone.container.config.ConfigType;
import com.keystone.utilities.UtilityNames;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

/**
 * The {@code logger} utility: SLF4J loggers named under the owning service, plus structured
 * event logging with sensitive fields masked.
 */
public final class LoggingUtility {

    public static final String REDACT_FIELDS_KEY = "logging.redact.fields";

    private final String serviceName;
    private final SensitiveDataRedactor redactor;
    private final Logger eventLog;

    public LoggingUtility(String serviceName, SensitiveDataRedactor redactor) {
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        if (redactor == null) {
            throw new IllegalArgumentException("redactor must not be null");
        }
        this.serviceName = serviceName;
        this.redactor = redactor;
        this.eventLog = LoggerFactory.getLogger("keystone.events." + serviceName);
    }

    static LoggingUtility fromConfig(String serviceName, ConfigSlice config) {
        return new LoggingUtility(serviceName, new SensitiveDataRedactor(config.getList(REDACT_FIELDS_KEY)));
    }

    /** Standard descriptor: depends on config. */
    public static UtilityDescriptor descriptor() {
        return UtilityDescriptor.of(UtilityNames.LOGGER, ctx -> fromConfig(ctx.serviceName(), ctx.config()))
                .dependsOn(UtilityNames.CONFIG)
                .reads(ConfigKey.optional(REDACT_FIELDS_KEY, ConfigType.LIST));
    }

    /** A logger for a component of this service. */
    public Logger logger(Class<?> component) {
        return LoggerFactory.getLogger(component);
    }

    /** A logger named {@code <service>.<name>}. */
    public Logger logger(String name) {
        return LoggerFactory.getLogger(serviceName + "." + name);
    }

    /** Logs a structured INFO event with sensitive fields masked. */
    public void event(String event, Map<String, ?> fields) {
        event(Level.INFO, event, fields);
    }

    /** Logs a structured event at the given level with sensitive fields masked. */
    public void event(Level level, String event, Map<String, ?> fields) {
        if (!eventLog.isEnabledForLevel(level)) {
            return;
        }
        eventLog.atLevel(level).log("event={} fields={}", event, redactor.redact(fields));
    }

    public SensitiveDataRedactor redactor() {
        return redactor;
    }

    public String serviceName() {
        return serviceName;
    }
}
