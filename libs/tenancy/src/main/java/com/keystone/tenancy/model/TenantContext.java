package com.keystone.tenancy.model;

import java.util.Set;

/**
 * Read-only view of a live tenant handed to agent code.
 *
 * @param tenantId   unique tenant identifier
 * @param tenantName display name
 * @param tenantType tier of the tenant
 * @param status     ACTIVE or SUSPENDED
 * @param features   entitled feature flags
 */
public record TenantContext(String tenantId, String tenantName, TenantType tenantType, TenantStatus status,
                            Set<String> features) {

    public TenantContext {
        features = features == null ? Set.of() : Set.copyOf(features);
    }

    public static TenantContext of(Tenant tenant) {
        return new TenantContext(tenant.tenantId(), tenant.name(), tenant.type(), tenant.status(), tenant.features());
    }

    public boolean hasFeature(String feature) {
        return status == TenantStatus.ACTIVE && features.contains(feature);
    }
}
