package com.keystone.utilities.security;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Platform-wide roles, independent of any tenant. PLATFORM_ADMIN implies OPERATOR and USER;
 * OPERATOR implies USER.
 */
public enum PlatformRole {

    USER("ROLE_USER"),
    OPERATOR("ROLE_OPERATOR"),
    PLATFORM_ADMIN("ROLE_PLATFORM_ADMIN");

    private final String value;

    PlatformRole(String value) {
        this.value = value;
    }

    /** The canonical string representation (e.g., "ROLE_PLATFORM_ADMIN"). */
    public String value() {
        return value;
    }

    public Set<PlatformRole> impliedRoles() {
        return switch (this) {
            case PLATFORM_ADMIN -> EnumSet.of(OPERATOR, USER);
            case OPERATOR -> EnumSet.of(USER);
            case USER -> EnumSet.noneOf(PlatformRole.class);
        };
    }

    public boolean implies(PlatformRole other) {
        return this == other || impliedRoles().contains(other);
    }

    /**
     * Looks up a role by canonical value ("ROLE_OPERATOR") or by name ("operator").
     */
    public static Optional<PlatformRole> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (PlatformRole role : values()) {
            if (role.value.equals(value) || role.name().equalsIgnoreCase(value)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
