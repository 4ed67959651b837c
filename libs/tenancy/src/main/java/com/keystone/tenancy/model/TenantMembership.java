package com.keystone.tenancy.model;

import java.time.Instant;

/**
 * A user's membership in one tenant. At most one exists per (tenant, user).
 */
public record TenantMembership(String tenantId, String userId, TenantRole role, Instant joinedAt, Instant updatedAt) {

    public TenantMembership {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
    }

    public TenantMembership withRole(TenantRole newRole, Instant now) {
        return new TenantMembership(tenantId, userId, newRole, joinedAt, now);
    }
}
