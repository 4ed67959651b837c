package com.keystone.tenancy.model;

import java.util.Map;
import java.util.Set;

/**
 * Request to create a tenant. A null type or maxUsers falls back to the configured tier
 * defaults; the requested features are added to the tier's default features.
 */
public record TenantSpec(
        String tenantId,
        String name,
        TenantType type,
        Set<String> features,
        Integer maxUsers,
        Map<String, String> metadata) {

    public TenantSpec {
        features = features == null ? Set.of() : Set.copyOf(features);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static TenantSpec of(String tenantId, String name) {
        return new TenantSpec(tenantId, name, null, null, null, null);
    }

    public TenantSpec withType(TenantType newType) {
        return new TenantSpec(tenantId, name, newType, features, maxUsers, metadata);
    }

    public TenantSpec withFeatures(Set<String> newFeatures) {
        return new TenantSpec(tenantId, name, type, newFeatures, maxUsers, metadata);
    }

    public TenantSpec withMaxUsers(int limit) {
        return new TenantSpec(tenantId, name, type, features, limit, metadata);
    }
}
