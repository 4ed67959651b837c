package com.keystone.utilities.security;

import com.keystone.container.bootstrap.UtilityDescriptor;
import com.keystone.container.config.ConfigKey;
import com.keystone.container.config.ConfigSlice;
import com.keystone.container.config.ConfigType;
import com.keystone.utilities.UtilityNames;
import com.keystone.utilities.validation.ValidationResult;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The {@code security} utility: turns an authenticated user ID and the role names asserted by the
 * web layer into a {@link CallerContext}. Platform-admin status comes only from the configured
 * admin list, never from asserted roles.
 */
public final class SecurityUtility {

    private static final Logger log = LoggerFactory.getLogger(SecurityUtility.class);

    public static final String PLATFORM_ADMINS_KEY = "security.platform.admins";

    private final Set<String> platformAdmins;

    public SecurityUtility(Collection<String> platformAdmins) {
        this.platformAdmins = Set.copyOf(platformAdmins);
    }

    static SecurityUtility fromConfig(ConfigSlice config) {
        return new SecurityUtility(config.getList(PLATFORM_ADMINS_KEY));
    }

    /** Standard descriptor: depends on config and logger. */
    public static UtilityDescriptor descriptor() {
        return UtilityDescriptor.of(UtilityNames.SECURITY, ctx -> fromConfig(ctx.config()))
                .dependsOn(UtilityNames.CONFIG, UtilityNames.LOGGER)
                .reads(ConfigKey.optional(PLATFORM_ADMINS_KEY, ConfigType.LIST));
    }

    /** Resolves a caller with no asserted roles. */
    public CallerContext resolveCaller(String userId) {
        return resolveCaller(userId, List.of());
    }

    /**
     * Resolves a caller. Unknown role names and asserted PLATFORM_ADMIN are dropped; every caller
     * holds at least USER.
     *
     * @throws IllegalArgumentException if the user ID is blank
     */
    public CallerContext resolveCaller(String userId, Collection<String> assertedRoles) {
        Set<PlatformRole> roles = EnumSet.of(PlatformRole.USER);
        for (String asserted : assertedRoles) {
            Optional<PlatformRole> role = PlatformRole.fromString(asserted);
            if (role.isEmpty()) {
                log.debug("Ignoring unknown role '{}' for user '{}'", asserted, userId);
            } else if (role.get() == PlatformRole.PLATFORM_ADMIN) {
                log.warn("User '{}' asserted {} without being a configured platform admin", userId, asserted);
            } else {
                roles.add(role.get());
            }
        }
        if (userId != null && platformAdmins.contains(userId)) {
            roles.add(PlatformRole.PLATFORM_ADMIN);
        }
        return new CallerContext(userId, roles);
    }

    public boolean isPlatformAdmin(CallerContext caller) {
        return caller != null && caller.isPlatformAdmin();
    }

    /**
     * Checks that a caller is well-formed and that any platform-admin role it carries is backed by
     * configuration.
     */
    public ValidationResult validate(CallerContext caller) {
        if (caller == null) {
            return ValidationResult.fail("caller must not be null");
        }
        List<String> errors = new ArrayList<>();
        if (caller.roles().isEmpty()) {
            errors.add("caller must hold at least one role");
        }
        if (caller.roles().contains(PlatformRole.PLATFORM_ADMIN) && !platformAdmins.contains(caller.userId())) {
            errors.add("user '%s' is not a configured platform admin".formatted(caller.userId()));
        }
        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    public Set<String> platformAdmins() {
        return platformAdmins;
    }
}
