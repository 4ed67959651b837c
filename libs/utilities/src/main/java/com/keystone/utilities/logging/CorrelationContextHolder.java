package com.keystone.utilities.logging;

import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.MDC;

/**
 * Thread-local holder for {@link CorrelationContext}, mirrored into SLF4J MDC so every log line
 * on the thread carries the request's identifiers.
 * <p>
 * Work handed to another thread must carry the context explicitly, typically through
 * {@link #callWithContext(CorrelationContext, Supplier)}.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Sets the context for the current thread and populates MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /** Clears the context and its MDC keys. */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
        MDC.remove(CorrelationContext.MDC_SERVICE_NAME);
        MDC.remove(CorrelationContext.MDC_TENANT_ID);
        MDC.remove(CorrelationContext.MDC_USER_ID);
        MDC.remove(CorrelationContext.MDC_OPERATION);
    }

    /**
     * Runs {@code work} with the given context, then restores whatever was set before.
     */
    public static <T> T callWithContext(CorrelationContext context, Supplier<T> work) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            return work.get();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    public static void runWithContext(CorrelationContext context, Runnable work) {
        callWithContext(context, () -> {
            work.run();
            return null;
        });
    }

    private static void populateMdc(CorrelationContext ctx) {
        putOrRemove(CorrelationContext.MDC_REQUEST_ID, ctx.requestId());
        putOrRemove(CorrelationContext.MDC_SERVICE_NAME, ctx.serviceName());
        putOrRemove(CorrelationContext.MDC_TENANT_ID, ctx.tenantId());
        putOrRemove(CorrelationContext.MDC_USER_ID, ctx.userId());
        putOrRemove(CorrelationContext.MDC_OPERATION, ctx.operation());
    }

    private static void putOrRemove(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
