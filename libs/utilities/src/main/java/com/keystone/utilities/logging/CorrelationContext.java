package com.keystone.utilities.logging;

import java.util.UUID;

/**
 * Identifiers that follow one agent request through logs and spans.
 *
 * @param requestId   unique ID for this request
 * @param serviceName logical service handling the request
 * @param tenantId    tenant the request is scoped to (nullable)
 * @param userId      acting user (nullable for system work)
 * @param operation   capability or protocol operation being run (nullable)
 */
public record CorrelationContext(
        String requestId,
        String serviceName,
        String tenantId,
        String userId,
        String operation
) {

    public static final String MDC_REQUEST_ID = "requestId";
    public static final String MDC_SERVICE_NAME = "serviceName";
    public static final String MDC_TENANT_ID = "tenantId";
    public static final String MDC_USER_ID = "userId";
    public static final String MDC_OPERATION = "operation";

    public CorrelationContext {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId must not be null or blank");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
    }

    /** A fresh context with a random request ID. */
    public static CorrelationContext forService(String serviceName) {
        return new CorrelationContext(UUID.randomUUID().toString(), serviceName, null, null, null);
    }

    public CorrelationContext withTenant(String tenant) {
        return new CorrelationContext(requestId, serviceName, tenant, userId, operation);
    }

    public CorrelationContext withUser(String user) {
        return new CorrelationContext(requestId, serviceName, tenantId, user, operation);
    }

    public CorrelationContext withOperation(String op) {
        return new CorrelationContext(requestId, serviceName, tenantId, userId, op);
    }
}
