package com.keystone.tenancy.protocol;

import com.keystone.container.DIContainer;
import com.keystone.container.UtilityUnavailableException;
import com.keystone.tenancy.TenantException;
import com.keystone.tenancy.TenantManagementUtility;
import com.keystone.tenancy.model.AuditOutcome;
import com.keystone.tenancy.model.Tenant;
import com.keystone.tenancy.model.TenantContext;
import com.keystone.tenancy.model.TenantFilter;
import com.keystone.tenancy.model.TenantHealth;
import com.keystone.tenancy.model.TenantMembership;
import com.keystone.tenancy.model.TenantPatch;
import com.keystone.tenancy.model.TenantRole;
import com.keystone.tenancy.model.TenantSpec;
import com.keystone.tenancy.model.UsageStats;
import com.keystone.utilities.UtilityNames;
import com.keystone.utilities.security.CallerContext;
import com.keystone.utilities.security.SecurityUtility;
import com.keystone.utilities.telemetry.TelemetryUtility;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The multi-tenant access protocol. Every tenant-scoped call resolves the {@code tenant}
 * utility from the container under a lease, resolves the tenant, validates the caller's access
 * and only then delegates.
 * <p>
 * Access rules:
 * <ul>
 *   <li>a call without a caller is DENIED;</li>
 *   <li>calls on an existing tenant need an active membership in an ACTIVE tenant;</li>
 *   <li>mutations additionally need a membership role implying TENANT_ADMIN;</li>
 *   <li>usage and health queries need only a retained membership, so they work on suspended and
 *       deleted tenants;</li>
 *   <li>configured platform admins bypass membership checks.</li>
 * </ul>
 * Checks run against a snapshot taken before delegation; the tenancy utility re-reads the tenant
 * under its per-tenant lock, so a mutation never resurrects a tenant deleted in between. Every
 * mutating call that names an existing tenant leaves an audit record; audit failures are logged
 * and counted, never propagated.
 */
public final class TenantProtocolEnforcer {

    private static final Logger log = LoggerFactory.getLogger(TenantProtocolEnforcer.class);

    static final String CALLS_METRIC = "keystone.tenant.calls";

    private enum Access {
        /** No tenant-scoped check (create, list). */
        NONE,
        /** Like MEMBER for live tenants; unknown or deleted tenants are a lookup miss. */
        LOOKUP,
        MEMBER,
        ADMIN,
        RETAINED_MEMBER
    }

    private final DIContainer container;
    private final AtomicLong auditFailures = new AtomicLong();

    public TenantProtocolEnforcer(DIContainer container) {
        if (container == null) {
            throw new IllegalArgumentException("container must not be null");
        }
        this.container = container;
    }

    /** The live tenant view, or empty (COMPLETED) for unknown and deleted tenants. */
    public ProtocolResult<Optional<TenantContext>> getTenantContext(CallerContext caller, String tenantId) {
        return call("get_tenant_context", caller, tenantId, Access.LOOKUP, false,
                tenants -> tenants.tenantContext(tenantId));
    }

    /** True only if the user is a member of the tenant and the tenant is ACTIVE. */
    public boolean validateTenantAccess(String userId, String tenantId) {
        return query("validate_tenant_access", tenants -> tenants.hasAccess(userId, tenantId));
    }

    public ProtocolResult<Tenant> createTenant(CallerContext caller, TenantSpec spec) {
        String tenantId = spec != null ? spec.tenantId() : null;
        return call("create_tenant", caller, tenantId, Access.NONE, true,
                tenants -> tenants.createTenant(spec, caller.userId()));
    }

    public ProtocolResult<Tenant> updateTenant(CallerContext caller, String tenantId, TenantPatch patch) {
        return call("update_tenant", caller, tenantId, Access.ADMIN, true,
                tenants -> tenants.updateTenant(tenantId, patch));
    }

    /** Soft delete; memberships and the audit trail are retained. */
    public ProtocolResult<Tenant> deleteTenant(CallerContext caller, String tenantId) {
        return call("delete_tenant", caller, tenantId, Access.ADMIN, true,
                tenants -> tenants.deleteTenant(tenantId));
    }

    /** Tenants the caller is a member of, or all matching tenants for a platform admin. */
    public ProtocolResult<List<Tenant>> listTenants(CallerContext caller, TenantFilter filter) {
        return call("list_tenants", caller, null, Access.NONE, false, tenants -> {
            List<Tenant> matching = tenants.listTenants(filter);
            if (isPlatformAdmin(caller)) {
                return matching;
            }
            Set<String> own = tenants.membershipsOf(caller.userId()).stream()
                    .map(TenantMembership::tenantId)
                    .collect(Collectors.toSet());
            return matching.stream().filter(tenant -> own.contains(tenant.tenantId())).toList();
        });
    }

    /** Adds a member, or updates the role of an existing one. */
    public ProtocolResult<TenantMembership> addUserToTenant(CallerContext caller, String tenantId, String userId,
                                                            TenantRole role) {
        return call("add_user_to_tenant", caller, tenantId, Access.ADMIN, true,
                tenants -> tenants.addUser(tenantId, userId, role));
    }

    /** Removes a member; completes with false if the user was not a member. */
    public ProtocolResult<Boolean> removeUserFromTenant(CallerContext caller, String tenantId, String userId) {
        return call("remove_user_from_tenant", caller, tenantId, Access.ADMIN, true,
                tenants -> tenants.removeUser(tenantId, userId));
    }

    public ProtocolResult<List<TenantMembership>> getTenantUsers(CallerContext caller, String tenantId) {
        return call("get_tenant_users", caller, tenantId, Access.MEMBER, false, tenants -> tenants.members(tenantId));
    }

    /** False if the tenant lacks the entitlement, is not ACTIVE, or cannot be resolved. */
    public boolean validateTenantFeatureAccess(String tenantId, String feature) {
        return query("validate_tenant_feature_access", tenants -> tenants.hasFeature(tenantId, feature));
    }

    public ProtocolResult<Tenant> grantTenantFeature(CallerContext caller, String tenantId, String feature) {
        return call("grant_tenant_feature", caller, tenantId, Access.ADMIN, true,
                tenants -> tenants.grantFeature(tenantId, feature));
    }

    public ProtocolResult<Tenant> revokeTenantFeature(CallerContext caller, String tenantId, String feature) {
        return call("revoke_tenant_feature", caller, tenantId, Access.ADMIN, true,
                tenants -> tenants.revokeFeature(tenantId, feature));
    }

    /** Usage aggregated from the audit trail; available after a soft delete. */
    public ProtocolResult<UsageStats> getTenantUsageStats(CallerContext caller, String tenantId) {
        return call("get_tenant_usage_stats", caller, tenantId, Access.RETAINED_MEMBER, false,
                tenants -> tenants.usageStats(tenantId));
    }

    public ProtocolResult<TenantHealth> getTenantHealthStatus(CallerContext caller, String tenantId) {
        return call("get_tenant_health_status", caller, tenantId, Access.RETAINED_MEMBER, false,
                tenants -> tenants.healthStatus(tenantId));
    }

    /**
     * Appends an audit record for a tenant that exists, deleted ones included. Records for tenant
     * ids that were never created are dropped. Never throws; failures are logged and counted.
     */
    public void auditTenantAction(String tenantId, String userId, String action, AuditOutcome outcome) {
        try {
            container.withUtility(UtilityNames.TENANT, TenantManagementUtility.class, tenants -> {
                auditQuietly(tenants, tenantId, userId, action, outcome);
                return null;
            });
        } catch (RuntimeException e) {
            auditFailed(tenantId, action, e);
        }
    }

    /** Audit writes that failed since this enforcer was created. */
    public long auditFailures() {
        return auditFailures.get();
    }

    public DIContainer container() {
        return container;
    }

    private <T> ProtocolResult<T> call(String operation, CallerContext caller, String tenantId, Access access,
                                       boolean mutating, Function<TenantManagementUtility, T> action) {
        CallTrace trace = new CallTrace(operation, caller, tenantId);
        if (caller == null) {
            return record(trace.deny("caller must be authenticated"));
        }
        ProtocolResult<T> result;
        try {
            result = container.withUtility(UtilityNames.TENANT, TenantManagementUtility.class,
                    tenants -> run(trace, tenants, caller, tenantId, access, mutating, action));
        } catch (UtilityUnavailableException e) {
            result = trace.error(ProtocolError.UTILITY_UNAVAILABLE, e.getMessage());
        }
        return record(result);
    }

    private <T> ProtocolResult<T> run(CallTrace trace, TenantManagementUtility tenants, CallerContext caller,
                                      String tenantId, Access access, boolean mutating,
                                      Function<TenantManagementUtility, T> action) {
        Optional<Tenant> tenant = tenants.findTenant(tenantId);
        boolean live = tenant.filter(t -> !t.isDeleted()).isPresent();
        Access effective = access == Access.LOOKUP ? (live ? Access.MEMBER : Access.NONE) : access;
        boolean missing = switch (effective) {
            case NONE, LOOKUP -> false;
            case MEMBER, ADMIN -> !live;
            case RETAINED_MEMBER -> tenant.isEmpty();
        };
        if (missing) {
            return trace.error(ProtocolError.NOT_FOUND, "Tenant '%s' not found".formatted(tenantId));
        }
        trace.advance(CallPhase.TENANT_RESOLVED);

        Optional<String> denial = denialReason(tenants, caller, tenantId, effective);
        if (denial.isPresent()) {
            if (mutating) {
                auditQuietly(tenants, tenantId, caller.userId(), trace.operation, AuditOutcome.DENIED);
            }
            return trace.deny(denial.get());
        }
        trace.advance(CallPhase.ACCESS_VALIDATED);

        trace.advance(CallPhase.DELEGATED);
        try {
            T value = action.apply(tenants);
            if (mutating) {
                auditQuietly(tenants, tenantId, caller.userId(), trace.operation, AuditOutcome.SUCCESS);
            }
            return trace.complete(value);
        } catch (TenantException e) {
            if (mutating) {
                auditQuietly(tenants, tenantId, caller.userId(), trace.operation, AuditOutcome.FAILURE);
            }
            return trace.error(ProtocolError.of(e.kind()), e.getMessage());
        } catch (RuntimeException e) {
            log.error("{} on tenant '{}' failed", trace.operation, tenantId, e);
            if (mutating) {
                auditQuietly(tenants, tenantId, caller.userId(), trace.operation, AuditOutcome.FAILURE);
            }
            return trace.error(ProtocolError.INTERNAL_ERROR, trace.operation + " failed: " + e.getMessage());
        }
    }

    private Optional<String> denialReason(TenantManagementUtility tenants, CallerContext caller, String tenantId,
                                          Access access) {
        if (access == Access.NONE || isPlatformAdmin(caller)) {
            return Optional.empty();
        }
        String userId = caller.userId();
        return switch (access) {
            case MEMBER -> tenants.hasAccess(userId, tenantId)
                    ? Optional.empty()
                    : Optional.of("user '%s' has no access to tenant '%s'".formatted(userId, tenantId));
            case ADMIN -> {
                boolean admin = tenants.hasAccess(userId, tenantId)
                        && tenants.membership(tenantId, userId)
                                .map(m -> m.role().implies(TenantRole.TENANT_ADMIN))
                                .orElse(false);
                yield admin
                        ? Optional.empty()
                        : Optional.of("user '%s' is not an admin of tenant '%s'".formatted(userId, tenantId));
            }
            case RETAINED_MEMBER -> tenants.membership(tenantId, userId).isPresent()
                    ? Optional.empty()
                    : Optional.of("user '%s' was never a member of tenant '%s'".formatted(userId, tenantId));
            case NONE, LOOKUP -> Optional.empty();
        };
    }

    /** Platform-admin status must be backed by the security utility's configured admin list. */
    private boolean isPlatformAdmin(CallerContext caller) {
        if (!caller.isPlatformAdmin()) {
            return false;
        }
        return container.findUtility(UtilityNames.SECURITY, SecurityUtility.class)
                .map(security -> security.validate(caller).valid())
                .orElse(false);
    }

    private boolean query(String operation, Function<TenantManagementUtility, Boolean> check) {
        try {
            return container.withUtility(UtilityNames.TENANT, TenantManagementUtility.class, check);
        } catch (UtilityUnavailableException e) {
            log.warn("{} answered false: {}", operation, e.getMessage());
            return false;
        }
    }

    private void auditQuietly(TenantManagementUtility tenants, String tenantId, String userId, String action,
                              AuditOutcome outcome) {
        if (tenants.findTenant(tenantId).isEmpty()) {
            log.debug("Skipping audit of '{}' for unknown tenant '{}'", action, tenantId);
            return;
        }
        try {
            tenants.audit(tenantId, userId, action, outcome, Map.of());
        } catch (RuntimeException e) {
            auditFailed(tenantId, action, e);
        }
    }

    private void auditFailed(String tenantId, String action, RuntimeException e) {
        long total = auditFailures.incrementAndGet();
        log.warn("Audit of '{}' on tenant '{}' failed ({} failures so far)", action, tenantId, total, e);
    }

    private <T> ProtocolResult<T> record(ProtocolResult<T> result) {
        container.findUtility(UtilityNames.TELEMETRY, TelemetryUtility.class).ifPresent(telemetry -> telemetry.metrics()
                .counter(CALLS_METRIC, "Tenant protocol calls by terminal phase", "phase", result.phase().name())
                .increment());
        return result;
    }

    private static final class CallTrace {

        private final String operation;
        private final String userId;
        private final String tenantId;
        private CallPhase phase = CallPhase.UNAUTHENTICATED;

        CallTrace(String operation, CallerContext caller, String tenantId) {
            this.operation = operation;
            this.userId = caller != null ? caller.userId() : null;
            this.tenantId = tenantId;
        }

        void advance(CallPhase next) {
            log.trace("{} [{} / {}]: {} -> {}", operation, userId, tenantId, phase, next);
            phase = next;
        }

        <T> ProtocolResult<T> complete(T value) {
            advance(CallPhase.COMPLETED);
            return ProtocolResult.completed(value);
        }

        <T> ProtocolResult<T> deny(String reason) {
            log.info("Denied {} for user '{}' on tenant '{}' at {}: {}", operation, userId, tenantId, phase, reason);
            phase = CallPhase.DENIED;
            return ProtocolResult.denied(reason);
        }

        <T> ProtocolResult<T> error(ProtocolError error, String message) {
            log.debug("{} for user '{}' on tenant '{}' errored at {}: {}", operation, userId, tenantId, phase, message);
            phase = CallPhase.ERRORED;
            return ProtocolResult.errored(error, message);
        }
    }
}
