package com.keystone.utilities.error;

import com.keystone.container.UtilityUnavailableException;
import com.keystone.container.bootstrap.BootstrapException;
import com.keystone.container.bootstrap.UtilityDescriptor;
import com.keystone.container.config.ConfigException;
import com.keystone.utilities.UtilityNames;
import com.keystone.utilities.logging.CorrelationContext;
import com.keystone.utilities.logging.CorrelationContextHolder;
import com.keystone.utilities.serialization.SerializationException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The {@code error_handler} utility: classifies any throwable into an {@link ErrorReport}, logs
 * it at a level matching its severity and counts it per error code.
 * <p>
 * Classification uses the most specific registered exception type; other modules register their
 * own exception types (tenancy errors, for instance) at wiring time.
 */
public final class ErrorHandlerUtility {

    private static final Logger log = LoggerFactory.getLogger(ErrorHandlerUtility.class);

    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private final Map<Class<? extends Throwable>, Classification<?>> classifications = new ConcurrentHashMap<>();
    private final Map<String, LongAdder> counts = new ConcurrentHashMap<>();

    public ErrorHandlerUtility() {
        register(IllegalArgumentException.class, e -> "INVALID_ARGUMENT", ErrorSeverity.LOW);
        register(SerializationException.class, e -> "SERIALIZATION_FAILED", ErrorSeverity.LOW);
        register(UtilityUnavailableException.class, e -> "UTILITY_UNAVAILABLE", ErrorSeverity.HIGH);
        register(ConfigException.class, e -> "CONFIG_" + e.kind(), ErrorSeverity.HIGH);
        register(BootstrapException.class, e -> "BOOTSTRAP_" + e.kind(), ErrorSeverity.CRITICAL);
    }

    /** Standard descriptor: depends on logger. */
    public static UtilityDescriptor descriptor() {
        return UtilityDescriptor.of(UtilityNames.ERROR_HANDLER, ctx -> new ErrorHandlerUtility())
                .dependsOn(UtilityNames.LOGGER);
    }

    /**
     * Registers how an exception type (and its subclasses) is classified.
     */
    public <T extends Throwable> void register(Class<T> type, Function<T, String> code, ErrorSeverity severity) {
        classifications.put(type, new Classification<>(type, code, severity));
    }

    /**
     * Classifies, logs and counts an error. Never throws.
     */
    public ErrorReport handle(Throwable error, String operation) {
        Classification<?> classification = classify(error.getClass());
        String code = classification != null ? classification.codeFor(error) : INTERNAL_ERROR;
        ErrorSeverity severity = classification != null ? classification.severity() : ErrorSeverity.MEDIUM;

        Map<String, String> context = new LinkedHashMap<>();
        context.put("exception", error.getClass().getName());
        CorrelationContextHolder.get().ifPresent(ctx -> {
            context.put(CorrelationContext.MDC_REQUEST_ID, ctx.requestId());
            if (ctx.tenantId() != null) {
                context.put(CorrelationContext.MDC_TENANT_ID, ctx.tenantId());
            }
            if (ctx.userId() != null) {
                context.put(CorrelationContext.MDC_USER_ID, ctx.userId());
            }
        });
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        ErrorReport report = new ErrorReport(code, message, operation, severity, Instant.now(), context);

        counts.computeIfAbsent(code, c -> new LongAdder()).increment();
        switch (severity) {
            case LOW -> log.info("[{}] {} failed: {}", code, operation, message);
            case MEDIUM -> log.warn("[{}] {} failed: {}", code, operation, message);
            case HIGH, CRITICAL -> log.error("[{}] {} failed: {}", code, operation, message, error);
        }
        return report;
    }

    /** Handled errors per code, sorted by code. */
    public Map<String, Long> errorCounts() {
        Map<String, Long> snapshot = new TreeMap<>();
        counts.forEach((code, count) -> snapshot.put(code, count.sum()));
        return snapshot;
    }

    private Classification<?> classify(Class<?> type) {
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            Classification<?> classification = classifications.get(current);
            if (classification != null) {
                return classification;
            }
        }
        return null;
    }

    private record Classification<T extends Throwable>(
            Class<T> type, Function<T, String> code, ErrorSeverity severity) {

        String codeFor(Throwable error) {
            return code.apply(type.cast(error));
        }
    }
}
