package com.keystone.tenancy.model;

import java.util.Map;

/**
 * Partial update of a tenant. Null fields are left unchanged. The status may move between
 * ACTIVE and SUSPENDED; deletion goes through the delete operation.
 */
public record TenantPatch(String name, TenantStatus status, Integer maxUsers, Map<String, String> metadata) {

    public TenantPatch {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static TenantPatch rename(String name) {
        return new TenantPatch(name, null, null, null);
    }

    public static TenantPatch status(TenantStatus status) {
        return new TenantPatch(null, status, null, null);
    }

    public static TenantPatch maxUsers(int maxUsers) {
        return new TenantPatch(null, null, maxUsers, null);
    }

    public boolean isEmpty() {
        return name == null && status == null && maxUsers == null && metadata.isEmpty();
    }
}
