package com.keystone.tenancy;

import com.keystone.container.bootstrap.UtilityDescriptor;
import com.keystone.container.config.ConfigKey;
import com.keystone.tenancy.model.AuditOutcome;
import com.keystone.tenancy.model.AuditRecord;
import com.keystone.tenancy.model.Tenant;
import com.keystone.tenancy.model.TenantContext;
import com.keystone.tenancy.model.TenantFilter;
import com.keystone.tenancy.model.TenantHealth;
import com.keystone.tenancy.model.TenantMembership;
import com.keystone.tenancy.model.TenantPatch;
import com.keystone.tenancy.model.TenantRole;
import com.keystone.tenancy.model.TenantSpec;
import com.keystone.tenancy.model.TenantStatus;
import com.keystone.tenancy.model.TenantType;
import com.keystone.tenancy.model.UsageStats;
import com.keystone.tenancy.store.InMemoryTenantStore;
import com.keystone.tenancy.store.TenantStore;
import com.keystone.utilities.UtilityNames;
import com.keystone.utilities.validation.ValidationResult;
import com.keystone.utilities.validation.ValidationUtility;
import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The {@code tenant} utility: owns tenants, memberships and the audit trail.
 * <p>
 * Mutations of one tenant run under that tenant's lock stripe and re-read the tenant inside it, so a
 * concurrent delete or suspension is never overwritten. Reads are lock-free against the store.
 * This class applies no caller access rules; callers go through the protocol enforcer.
 */
public final class TenantManagementUtility {

    private static final Logger log = LoggerFactory.getLogger(TenantManagementUtility.class);

    /** Number of lock stripes; a tenant id always maps to the same stripe. */
    static final int LOCK_STRIPES = 64;

    private final TenantStore store;
    private final TenantTierPolicy policy;
    private final ValidationUtility validation;
    private final Clock clock;
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    public TenantManagementUtility(TenantStore store, TenantTierPolicy policy, ValidationUtility validation,
                                   Clock clock) {
        this.store = store;
        this.policy = policy;
        this.validation = validation;
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    public TenantManagementUtility(TenantStore store, TenantTierPolicy policy, ValidationUtility validation) {
        this(store, policy, validation, Clock.systemUTC());
    }

    /** Standard descriptor backed by a fresh {@link InMemoryTenantStore} per generation. */
    public static UtilityDescriptor descriptor() {
        return descriptor(InMemoryTenantStore::new);
    }

    /**
     * Descriptor backed by the given store supplier; depends on config, logger, validation and
     * security.
     */
    public static UtilityDescriptor descriptor(Supplier<? extends TenantStore> stores) {
        return UtilityDescriptor.of(UtilityNames.TENANT, ctx -> new TenantManagementUtility(
                        stores.get(),
                        TenantTierPolicy.fromConfig(ctx.config()),
                        ctx.dependency(UtilityNames.VALIDATION, ValidationUtility.class)))
                .dependsOn(UtilityNames.CONFIG, UtilityNames.LOGGER, UtilityNames.VALIDATION, UtilityNames.SECURITY)
                .reads(TenantTierPolicy.configKeys().toArray(ConfigKey[]::new));
    }

    // --- tenants ---

    /**
     * Creates a tenant and makes the creator its TENANT_ADMIN.
     *
     * @throws TenantException INVALID_REQUEST for a malformed spec, DUPLICATE_TENANT if the ID
     *                         was ever used
     */
    public Tenant createTenant(TenantSpec spec, String creatorUserId) {
        if (spec == null) {
            throw TenantException.invalidRequest(null, "tenant spec must not be null");
        }
        ValidationResult result = validation.check()
                .identifier("tenantId", spec.tenantId())
                .notBlank("name", spec.name())
                .notBlank("creatorUserId", creatorUserId)
                .identifiers("features", spec.features())
                .require(spec.maxUsers() == null || spec.maxUsers() > 0, "maxUsers must be positive")
                .result();
        if (!result.valid()) {
            throw TenantException.invalidRequest(spec.tenantId(), result.message());
        }

        return withTenantLock(spec.tenantId(), () -> {
            TenantType type = spec.type() != null ? spec.type() : policy.defaultType();
            Set<String> features = new HashSet<>(policy.featuresFor(type));
            features.addAll(spec.features());
            int maxUsers = spec.maxUsers() != null ? spec.maxUsers() : policy.maxUsersFor(type);
            Instant now = clock.instant();
            Tenant tenant = new Tenant(spec.tenantId(), spec.name(), type, TenantStatus.ACTIVE, features, maxUsers,
                    creatorUserId, spec.metadata(), now, now);
            if (!store.insertTenant(tenant)) {
                throw TenantException.duplicate(spec.tenantId());
            }
            store.upsertMembership(new TenantMembership(tenant.tenantId(), creatorUserId, TenantRole.TENANT_ADMIN, now, now));
            log.info("Created tenant '{}' ({}, max {} users) for '{}'", tenant.tenantId(), type.value(), maxUsers,
                    creatorUserId);
            return tenant;
        });
    }

    /** Any tenant ever created, deleted ones included. */
    public Optional<Tenant> findTenant(String tenantId) {
        return tenantId == null ? Optional.empty() : store.findTenant(tenantId);
    }

    /** The live tenant view; empty for unknown and deleted tenants. */
    public Optional<TenantContext> tenantContext(String tenantId) {
        return findTenant(tenantId).filter(tenant -> !tenant.isDeleted()).map(TenantContext::of);
    }

    /**
     * @throws TenantException NOT_FOUND for unknown or deleted tenants, INVALID_REQUEST for a
     *                         patch that deletes or empties the name, USER_LIMIT_EXCEEDED if
     *                         the new limit is below the current member count
     */
    public Tenant updateTenant(String tenantId, TenantPatch patch) {
        if (patch == null || patch.isEmpty()) {
            throw TenantException.invalidRequest(tenantId, "patch must change at least one field");
        }
        if (patch.status() == TenantStatus.DELETED) {
            throw TenantException.invalidRequest(tenantId, "use delete to remove a tenant");
        }
        if (patch.name() != null && patch.name().isBlank()) {
            throw TenantException.invalidRequest(tenantId, "name must not be blank");
        }
        return withTenantLock(tenantId, () -> {
            Tenant current = liveTenant(tenantId);
            if (patch.maxUsers() != null) {
                if (patch.maxUsers() <= 0) {
                    throw TenantException.invalidRequest(tenantId, "maxUsers must be positive");
                }
                if (patch.maxUsers() < store.memberships(tenantId).size()) {
                    throw TenantException.userLimitExceeded(tenantId, patch.maxUsers());
                }
            }
            Tenant updated = current.apply(patch, clock.instant());
            store.updateTenant(updated);
            if (current.status() != updated.status()) {
                log.info("Tenant '{}' is now {}", tenantId, updated.status());
            }
            return updated;
        });
    }

    /**
     * Soft-deletes a tenant; memberships and audit records are kept.
     *
     * @throws TenantException NOT_FOUND for unknown or already deleted tenants
     */
    public Tenant deleteTenant(String tenantId) {
        return withTenantLock(tenantId, () -> {
            liveTenant(tenantId);
            Tenant deleted = store.softDeleteTenant(tenantId, clock.instant())
                    .orElseThrow(() -> TenantException.notFound(tenantId));
            log.info("Deleted tenant '{}'", tenantId);
            return deleted;
        });
    }

    public List<Tenant> listTenants(TenantFilter filter) {
        TenantFilter effective = filter != null ? filter : TenantFilter.all();
        return store.allTenants().stream().filter(effective::matches).toList();
    }

    // --- features ---

    /**
     * @throws TenantException NOT_FOUND for unknown or deleted tenants, INVALID_REQUEST for a
     *                         malformed feature name
     */
    public Tenant grantFeature(String tenantId, String feature) {
        return changeFeatures(tenantId, feature, true);
    }

    /**
     * @throws TenantException NOT_FOUND for unknown or deleted tenants, INVALID_REQUEST for a
     *                         malformed feature name
     */
    public Tenant revokeFeature(String tenantId, String feature) {
        return changeFeatures(tenantId, feature, false);
    }

    /** True only for an ACTIVE tenant entitled to the feature. */
    public boolean hasFeature(String tenantId, String feature) {
        return findTenant(tenantId).filter(Tenant::isActive).map(tenant -> tenant.hasFeature(feature)).orElse(false);
    }

    // --- memberships ---

    /**
     * Adds a user or changes the role of an existing member.
     *
     * @throws TenantException NOT_FOUND for unknown or deleted tenants, USER_LIMIT_EXCEEDED when
     *                         a new member would exceed the tenant's limit
     */
    public TenantMembership addUser(String tenantId, String userId, TenantRole role) {
        ValidationResult result = validation.check()
                .notBlank("userId", userId)
                .notNull("role", role)
                .result();
        if (!result.valid()) {
            throw TenantException.invalidRequest(tenantId, result.message());
        }
        return withTenantLock(tenantId, () -> {
            Tenant tenant = liveTenant(tenantId);
            Instant now = clock.instant();
            Optional<TenantMembership> existing = store.findMembership(tenantId, userId);
            TenantMembership membership;
            if (existing.isPresent()) {
                membership = existing.get().withRole(role, now);
            } else {
                if (store.memberships(tenantId).size() >= tenant.maxUsers()) {
                    throw TenantException.userLimitExceeded(tenantId, tenant.maxUsers());
                }
                membership = new TenantMembership(tenantId, userId, role, now, now);
            }
            store.upsertMembership(membership);
            log.debug("User '{}' is {} of tenant '{}'", userId, role, tenantId);
            return membership;
        });
    }

    /**
     * Removes a membership; removing a non-member is a no-op.
     *
     * @return true if a membership was removed
     * @throws TenantException NOT_FOUND for unknown or deleted tenants
     */
    public boolean removeUser(String tenantId, String userId) {
        return withTenantLock(tenantId, () -> {
            liveTenant(tenantId);
            boolean removed = store.removeMembership(tenantId, userId);
            if (removed) {
                log.debug("User '{}' removed from tenant '{}'", userId, tenantId);
            }
            return removed;
        });
    }

    public List<TenantMembership> members(String tenantId) {
        return store.memberships(tenantId);
    }

    public Optional<TenantMembership> membership(String tenantId, String userId) {
        if (tenantId == null || userId == null) {
            return Optional.empty();
        }
        return store.findMembership(tenantId, userId);
    }

    public List<TenantMembership> membershipsOf(String userId) {
        return userId == null ? List.of() : store.membershipsOf(userId);
    }

    /** True only if the user is a member and the tenant is ACTIVE. */
    public boolean hasAccess(String userId, String tenantId) {
        return findTenant(tenantId).filter(Tenant::isActive).isPresent()
                && membership(tenantId, userId).isPresent();
    }

    // --- audit and usage ---

    /**
     * Appends an audit record.
     *
     * @throws AuditWriteFailedException if the store rejects the record
     */
    public AuditRecord audit(String tenantId, String userId, String action, AuditOutcome outcome,
                             Map<String, String> details) {
        try {
            AuditRecord record = new AuditRecord(UUID.randomUUID().toString(), tenantId, userId, action, outcome,
                    clock.instant(), details);
            store.appendAudit(record);
            return record;
        } catch (RuntimeException e) {
            throw new AuditWriteFailedException(tenantId, action, e);
        }
    }

    public List<AuditRecord> auditTrail(String tenantId) {
        return store.auditTrail(tenantId);
    }

    /**
     * Aggregates usage from the audit trail. Works for deleted tenants too.
     *
     * @throws TenantException NOT_FOUND if the tenant never existed
     */
    public UsageStats usageStats(String tenantId) {
        Tenant tenant = findTenant(tenantId).orElseThrow(() -> TenantException.notFound(tenantId));
        List<AuditRecord> trail = store.auditTrail(tenantId);
        int users = store.memberships(tenantId).size();

        long successful = 0;
        long denied = 0;
        long failed = 0;
        Instant lastActive = null;
        Map<String, Long> byType = new TreeMap<>();
        for (AuditRecord record : trail) {
            switch (record.outcome()) {
                case SUCCESS -> successful++;
                case DENIED -> denied++;
                case FAILURE -> failed++;
            }
            byType.merge(record.action(), 1L, Long::sum);
            if (lastActive == null || record.timestamp().isAfter(lastActive)) {
                lastActive = record.timestamp();
            }
        }
        double percentage = users * 100.0 / tenant.maxUsers();
        return new UsageStats(tenantId, users, tenant.maxUsers(), percentage, trail.size(), successful, denied,
                failed, byType, lastActive);
    }

    /**
     * @throws TenantException NOT_FOUND if the tenant never existed
     */
    public TenantHealth healthStatus(String tenantId) {
        Tenant tenant = findTenant(tenantId).orElseThrow(() -> TenantException.notFound(tenantId));
        return TenantHealth.of(tenant, store.memberships(tenantId).size());
    }

    public TenantTierPolicy policy() {
        return policy;
    }

    private Tenant changeFeatures(String tenantId, String feature, boolean grant) {
        ValidationResult result = validation.validateIdentifier("feature", feature);
        if (!result.valid()) {
            throw TenantException.invalidRequest(tenantId, result.message());
        }
        return withTenantLock(tenantId, () -> {
            Tenant current = liveTenant(tenantId);
            Set<String> features = new HashSet<>(current.features());
            boolean changed = grant ? features.add(feature) : features.remove(feature);
            if (!changed) {
                return current;
            }
            Tenant updated = current.withFeatures(features, clock.instant());
            store.updateTenant(updated);
            log.info("Feature '{}' {} for tenant '{}'", feature, grant ? "granted" : "revoked", tenantId);
            return updated;
        });
    }

    private Tenant liveTenant(String tenantId) {
        return findTenant(tenantId)
                .filter(tenant -> !tenant.isDeleted())
                .orElseThrow(() -> TenantException.notFound(tenantId));
    }

    ReentrantLock lockFor(String tenantId) {
        return locks[Math.floorMod(tenantId.hashCode(), LOCK_STRIPES)];
    }

    private <T> T withTenantLock(String tenantId, Supplier<T> work) {
        if (tenantId == null || tenantId.isBlank()) {
            throw TenantException.invalidRequest(tenantId, "tenantId must not be null or blank");
        }
        ReentrantLock lock = lockFor(tenantId);
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }
}
