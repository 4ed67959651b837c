package com.keystone.utilities.telemetry;

import com.keystone.utilities.logging.CorrelationContextHolder;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper over an OpenTelemetry {@link Tracer} that tags every span with the current
 * correlation context (service, tenant, user, operation, request).
 */
public final class SpanHelper {

    public static final String ATTR_SERVICE = "keystone.service";
    public static final String ATTR_TENANT = "keystone.tenant.id";
    public static final String ATTR_USER = "keystone.user.id";
    public static final String ATTR_OPERATION = "keystone.operation";
    public static final String ATTR_REQUEST = "keystone.request.id";

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /** Runs {@code work} inside an INTERNAL span. */
    public <T> T inSpan(String spanName, Supplier<T> work) {
        return inSpan(spanName, SpanKind.INTERNAL, Map.of(), work);
    }

    /**
     * Runs {@code work} inside a span of the given kind. A runtime exception marks the span as
     * ERROR, is recorded on it and is rethrown.
     */
    public <T> T inSpan(String spanName, SpanKind kind, Map<String, String> attributes, Supplier<T> work) {
        SpanBuilder builder = tracer.spanBuilder(spanName).setSpanKind(kind);
        attributes.forEach(builder::setAttribute);
        Span span = builder.startSpan();

        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute(ATTR_SERVICE, ctx.serviceName());
            span.setAttribute(ATTR_REQUEST, ctx.requestId());
            if (ctx.tenantId() != null) {
                span.setAttribute(ATTR_TENANT, ctx.tenantId());
            }
            if (ctx.userId() != null) {
                span.setAttribute(ATTR_USER, ctx.userId());
            }
            if (ctx.operation() != null) {
                span.setAttribute(ATTR_OPERATION, ctx.operation());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage() != null ? e.getMessage() : e.getClass().getName());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public void inSpan(String spanName, Runnable work) {
        inSpan(spanName, () -> {
            work.run();
            return null;
        });
    }

    public Tracer tracer() {
        return tracer;
    }
}
