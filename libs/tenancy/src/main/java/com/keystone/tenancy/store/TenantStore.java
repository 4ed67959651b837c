package com.keystone.tenancy.store;

import com.keystone.tenancy.model.AuditRecord;
import com.keystone.tenancy.model.Tenant;
import com.keystone.tenancy.model.TenantMembership;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for tenants, memberships and the audit trail.
 * <p>
 * Implementations must be thread-safe. Writers for the same tenant are already serialized by the
 * tenancy utility; audit appends for any tenant may arrive concurrently and must not block each
 * other.
 */
public interface TenantStore {

    /**
     * Inserts a new tenant.
     *
     * @return false if a tenant with the same ID exists, deleted or not
     */
    boolean insertTenant(Tenant tenant);

    Optional<Tenant> findTenant(String tenantId);

    /**
     * Replaces an existing tenant.
     *
     * @return false if no tenant with that ID exists
     */
    boolean updateTenant(Tenant tenant);

    /**
     * Marks a tenant DELETED. Memberships and audit records are kept.
     *
     * @return the deleted tenant, or empty if it does not exist
     */
    Optional<Tenant> softDeleteTenant(String tenantId, Instant deletedAt);

    Collection<Tenant> allTenants();

    /** Inserts or replaces the membership for its (tenant, user) pair. */
    void upsertMembership(TenantMembership membership);

    /** @return true if a membership was removed */
    boolean removeMembership(String tenantId, String userId);

    Optional<TenantMembership> findMembership(String tenantId, String userId);

    List<TenantMembership> memberships(String tenantId);

    List<TenantMembership> membershipsOf(String userId);

    /** Appends a write-once audit record. */
    void appendAudit(AuditRecord record);

    /** Audit records of a tenant in append order. */
    List<AuditRecord> auditTrail(String tenantId);
}
