package com.keystone.tenancy.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * An isolated customer boundary. Immutable; every change produces a new instance with a fresh
 * {@code updatedAt}.
 *
 * @param tenantId    unique, never reused (not even after a soft delete)
 * @param name        display name
 * @param type        tier
 * @param status      lifecycle status
 * @param features    feature flags the tenant is entitled to
 * @param maxUsers    membership limit
 * @param adminUserId user who created the tenant
 * @param metadata    free-form display metadata
 * @param createdAt   creation instant
 * @param updatedAt   last change instant
 */
public record Tenant(
        String tenantId,
        String name,
        TenantType type,
        TenantStatus status,
        Set<String> features,
        int maxUsers,
        String adminUserId,
        Map<String, String> metadata,
        Instant createdAt,
        Instant updatedAt) {

    public Tenant {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        if (maxUsers <= 0) {
            throw new IllegalArgumentException("maxUsers must be positive");
        }
        features = features == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(features));
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public boolean isActive() {
        return status == TenantStatus.ACTIVE;
    }

    public boolean isDeleted() {
        return status == TenantStatus.DELETED;
    }

    public boolean hasFeature(String feature) {
        return features.contains(feature);
    }

    public Tenant withStatus(TenantStatus newStatus, Instant now) {
        return new Tenant(tenantId, name, type, newStatus, features, maxUsers, adminUserId, metadata, createdAt, now);
    }

    public Tenant withFeatures(Set<String> newFeatures, Instant now) {
        return new Tenant(tenantId, name, type, status, newFeatures, maxUsers, adminUserId, metadata, createdAt, now);
    }

    /** Applies the non-null fields of a patch. Metadata entries are merged. */
    public Tenant apply(TenantPatch patch, Instant now) {
        Map<String, String> mergedMetadata = new LinkedHashMap<>(metadata);
        mergedMetadata.putAll(patch.metadata());
        return new Tenant(
                tenantId,
                patch.name() != null ? patch.name() : name,
                type,
                patch.status() != null ? patch.status() : status,
                features,
                patch.maxUsers() != null ? patch.maxUsers() : maxUsers,
                adminUserId,
                mergedMetadata,
                createdAt,
                now);
    }
}
