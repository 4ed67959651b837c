package com.keystone.tenancy.model;

/**
 * Criteria for listing tenants. Null criteria match everything; deleted tenants are excluded
 * unless asked for.
 */
public record TenantFilter(TenantStatus status, TenantType type, boolean includeDeleted) {

    public static TenantFilter all() {
        return new TenantFilter(null, null, false);
    }

    public static TenantFilter withStatus(TenantStatus status) {
        return new TenantFilter(status, null, status == TenantStatus.DELETED);
    }

    public boolean matches(Tenant tenant) {
        if (tenant.isDeleted() && !includeDeleted) {
            return false;
        }
        return (status == null || tenant.status() == status) && (type == null || tenant.type() == type);
    }
}
