package com.keystone.tenancy.store;

import com.keystone.tenancy.model.AuditRecord;
import com.keystone.tenancy.model.Tenant;
import com.keystone.tenancy.model.TenantMembership;
import com.keystone.tenancy.model.TenantStatus;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Process-local {@link TenantStore}. Each container generation gets its own instance.
 */
public final class InMemoryTenantStore implements TenantStore {

    private static final Comparator<TenantMembership> MEMBERSHIP_ORDER =
            Comparator.comparing(TenantMembership::joinedAt).thenComparing(TenantMembership::userId);

    private final Map<String, Tenant> tenants = new ConcurrentHashMap<>();
    private final Map<String, Map<String, TenantMembership>> memberships = new ConcurrentHashMap<>();
    private final Map<String, ConcurrentLinkedQueue<AuditRecord>> audit = new ConcurrentHashMap<>();

    @Override
    public boolean insertTenant(Tenant tenant) {
        return tenants.putIfAbsent(tenant.tenantId(), tenant) == null;
    }

    @Override
    public Optional<Tenant> findTenant(String tenantId) {
        return Optional.ofNullable(tenants.get(tenantId));
    }

    @Override
    public boolean updateTenant(Tenant tenant) {
        return tenants.replace(tenant.tenantId(), tenant) != null;
    }

    @Override
    public Optional<Tenant> softDeleteTenant(String tenantId, Instant deletedAt) {
        return Optional.ofNullable(
                tenants.computeIfPresent(tenantId, (id, current) -> current.withStatus(TenantStatus.DELETED, deletedAt)));
    }

    @Override
    public Collection<Tenant> allTenants() {
        return tenants.values().stream()
                .sorted(Comparator.comparing(Tenant::tenantId))
                .toList();
    }

    @Override
    public void upsertMembership(TenantMembership membership) {
        memberships.computeIfAbsent(membership.tenantId(), id -> new ConcurrentHashMap<>())
                .put(membership.userId(), membership);
    }

    @Override
    public boolean removeMembership(String tenantId, String userId) {
        Map<String, TenantMembership> members = memberships.get(tenantId);
        return members != null && members.remove(userId) != null;
    }

    @Override
    public Optional<TenantMembership> findMembership(String tenantId, String userId) {
        Map<String, TenantMembership> members = memberships.get(tenantId);
        return members == null ? Optional.empty() : Optional.ofNullable(members.get(userId));
    }

    @Override
    public List<TenantMembership> memberships(String tenantId) {
        Map<String, TenantMembership> members = memberships.get(tenantId);
        return members == null ? List.of() : members.values().stream().sorted(MEMBERSHIP_ORDER).toList();
    }

    @Override
    public List<TenantMembership> membershipsOf(String userId) {
        return memberships.values().stream()
                .map(members -> members.get(userId))
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(TenantMembership::tenantId))
                .toList();
    }

    @Override
    public void appendAudit(AuditRecord record) {
        audit.computeIfAbsent(record.tenantId(), id -> new ConcurrentLinkedQueue<>()).add(record);
    }

    @Override
    public List<AuditRecord> auditTrail(String tenantId) {
        ConcurrentLinkedQueue<AuditRecord> records = audit.get(tenantId);
        return records == null ? List.of() : List.copyOf(records);
    }
}
