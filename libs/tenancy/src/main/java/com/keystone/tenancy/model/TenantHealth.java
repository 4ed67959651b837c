package com.keystone.tenancy.model;

/**
 * Point-in-time health of a tenant: healthy when active and within its user limit.
 */
public record TenantHealth(
        String tenantId,
        TenantStatus status,
        int memberCount,
        int maxUsers,
        boolean atCapacity,
        boolean healthy) {

    public static TenantHealth of(Tenant tenant, int memberCount) {
        boolean atCapacity = memberCount >= tenant.maxUsers();
        boolean healthy = tenant.isActive() && memberCount <= tenant.maxUsers();
        return new TenantHealth(tenant.tenantId(), tenant.status(), memberCount, tenant.maxUsers(), atCapacity, healthy);
    }
}
