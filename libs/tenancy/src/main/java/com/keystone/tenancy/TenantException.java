package com.keystone.tenancy;

/**
 * A tenant operation that cannot be carried out. Returned to protocol callers as a typed result;
 * never fatal to the service.
 */
public class TenantException extends RuntimeException {

    public enum Kind {
        NOT_FOUND,
        DUPLICATE_TENANT,
        ACCESS_DENIED,
        USER_LIMIT_EXCEEDED,
        INVALID_REQUEST
    }

    private final Kind kind;
    private final String tenantId;

    public TenantException(Kind kind, String tenantId, String message) {
        super(message);
        this.kind = kind;
        this.tenantId = tenantId;
    }

    public static TenantException notFound(String tenantId) {
        return new TenantException(Kind.NOT_FOUND, tenantId, "Tenant '%s' not found".formatted(tenantId));
    }

    public static TenantException duplicate(String tenantId) {
        return new TenantException(Kind.DUPLICATE_TENANT, tenantId, "Tenant '%s' already exists".formatted(tenantId));
    }

    public static TenantException accessDenied(String userId, String tenantId, String reason) {
        return new TenantException(Kind.ACCESS_DENIED, tenantId,
                "User '%s' may not access tenant '%s': %s".formatted(userId, tenantId, reason));
    }

    public static TenantException userLimitExceeded(String tenantId, int maxUsers) {
        return new TenantException(Kind.USER_LIMIT_EXCEEDED, tenantId,
                "Tenant '%s' has reached its limit of %d users".formatted(tenantId, maxUsers));
    }

    public static TenantException invalidRequest(String tenantId, String reason) {
        return new TenantException(Kind.INVALID_REQUEST, tenantId, reason);
    }

    public Kind kind() {
        return kind;
    }

    public String tenantId() {
        return tenantId;
    }
}
