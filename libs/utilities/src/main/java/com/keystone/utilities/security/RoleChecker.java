package com.keystone.utilities.security;

/**
 * Role checks that honour the {@link PlatformRole} hierarchy.
 */
public final class RoleChecker {

    private RoleChecker() {
        // utility class
    }

    /** True if the caller holds {@code required} directly or through the hierarchy. */
    public static boolean hasRole(CallerContext caller, PlatformRole required) {
        return caller.roles().stream().anyMatch(role -> role.implies(required));
    }

    public static boolean hasAnyRole(CallerContext caller, PlatformRole... required) {
        for (PlatformRole role : required) {
            if (hasRole(caller, role)) {
                return true;
            }
        }
        return false;
    }

    public static boolean hasAllRoles(CallerContext caller, PlatformRole... required) {
        for (PlatformRole role : required) {
            if (!hasRole(caller, role)) {
                return false;
            }
        }
        return true;
    }
}
