package com.keystone.tenancy.model;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * A user's role inside one tenant. TENANT_ADMIN implies MEMBER and VIEWER; MEMBER implies
 * VIEWER.
 */
public enum TenantRole {

    TENANT_ADMIN("admin"),
    MEMBER("member"),
    VIEWER("viewer");

    private final String value;

    TenantRole(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public Set<TenantRole> impliedRoles() {
        return switch (this) {
            case TENANT_ADMIN -> EnumSet.of(MEMBER, VIEWER);
            case MEMBER -> EnumSet.of(VIEWER);
            case VIEWER -> EnumSet.noneOf(TenantRole.class);
        };
    }

    public boolean implies(TenantRole other) {
        return this == other || impliedRoles().contains(other);
    }

    /**
     * Looks up a role by short value ("admin") or enum name ("TENANT_ADMIN"), ignoring case.
     */
    public static Optional<TenantRole> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (TenantRole role : values()) {
            if (role.value.equalsIgnoreCase(value) || role.name().equalsIgnoreCase(value)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
