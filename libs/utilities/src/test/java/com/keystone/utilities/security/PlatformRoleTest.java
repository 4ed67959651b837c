package com.keystone.utilities.security;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PlatformRole and RoleChecker")
class PlatformRoleTest {

    @Test
    @DisplayName("should encode the role hierarchy")
    void shouldEncodeHierarchy() {
        assertThat(PlatformRole.PLATFORM_ADMIN.implies(PlatformRole.OPERATOR)).isTrue();
        assertThat(PlatformRole.PLATFORM_ADMIN.implies(PlatformRole.USER)).isTrue();
        assertThat(PlatformRole.OPERATOR.implies(PlatformRole.USER)).isTrue();
        assertThat(PlatformRole.OPERATOR.implies(PlatformRole.PLATFORM_ADMIN)).isFalse();
        assertThat(PlatformRole.USER.impliedRoles()).isEmpty();
    }

    @Test
    @DisplayName("should parse canonical values and names")
    void shouldParse() {
        assertThat(PlatformRole.fromString("ROLE_OPERATOR")).contains(PlatformRole.OPERATOR);
        assertThat(PlatformRole.fromString("platform_admin")).contains(PlatformRole.PLATFORM_ADMIN);
        assertThat(PlatformRole.fromString("ROLE_ROOT")).isEmpty();
        assertThat(PlatformRole.fromString(null)).isEmpty();
    }

    @Test
    @DisplayName("should check roles through the hierarchy")
    void shouldCheckThroughHierarchy() {
        var operator = new CallerContext("bob", Set.of(PlatformRole.OPERATOR));

        assertThat(RoleChecker.hasRole(operator, PlatformRole.USER)).isTrue();
        assertThat(RoleChecker.hasAnyRole(operator, PlatformRole.PLATFORM_ADMIN, PlatformRole.OPERATOR)).isTrue();
        assertThat(RoleChecker.hasAllRoles(operator, PlatformRole.USER, PlatformRole.PLATFORM_ADMIN)).isFalse();
        assertThat(operator.isPlatformAdmin()).isFalse();
        assertThat(CallerContext.platformAdmin("root").isPlatformAdmin()).isTrue();
    }
}
