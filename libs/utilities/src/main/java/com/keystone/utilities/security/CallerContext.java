package com.keystone.utilities.security;

import java.util.EnumSet;
import java.util.Set;

/**
 * The user on whose behalf a tenant-scoped operation runs.
 *
 * @param userId authenticated user ID
 * @param roles  platform roles held by the user
 */
public record CallerContext(String userId, Set<PlatformRole> roles) {

    public CallerContext {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
        roles = roles == null || roles.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(roles));
    }

    /** A regular platform user. */
    public static CallerContext user(String userId) {
        return new CallerContext(userId, Set.of(PlatformRole.USER));
    }

    /** A caller holding the platform-admin capability. */
    public static CallerContext platformAdmin(String userId) {
        return new CallerContext(userId, Set.of(PlatformRole.PLATFORM_ADMIN));
    }

    public boolean isPlatformAdmin() {
        return RoleChecker.hasRole(this, PlatformRole.PLATFORM_ADMIN);
    }
}
