package com.keystone.tenancy.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.keystone.tenancy.model.AuditOutcome;
import com.keystone.tenancy.model.AuditRecord;
import com.keystone.tenancy.model.Tenant;
import com.keystone.tenancy.model.TenantMembership;
import com.keystone.tenancy.model.TenantRole;
import com.keystone.tenancy.model.TenantStatus;
import com.keystone.tenancy.model.TenantType;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryTenantStore")
class InMemoryTenantStoreTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private final InMemoryTenantStore store = new InMemoryTenantStore();

    private static Tenant tenant(String id) {
        return new Tenant(id, id.toUpperCase(), TenantType.ORGANIZATION, TenantStatus.ACTIVE, Set.of(), 10, "alice",
                Map.of(), NOW, NOW);
    }

    @Test
    @DisplayName("should refuse a second tenant with the same ID")
    void shouldRejectDuplicateInsert() {
        assertThat(store.insertTenant(tenant("acme"))).isTrue();
        assertThat(store.insertTenant(tenant("acme"))).isFalse();
        assertThat(store.updateTenant(tenant("globex"))).isFalse();
    }

    @Test
    @DisplayName("should keep memberships and audit records after a soft delete")
    void shouldRetainHistoryOnSoftDelete() {
        store.insertTenant(tenant("acme"));
        store.upsertMembership(new TenantMembership("acme", "alice", TenantRole.TENANT_ADMIN, NOW, NOW));
        store.appendAudit(new AuditRecord("r1", "acme", "alice", "create_tenant", AuditOutcome.SUCCESS, NOW, null));

        Tenant deleted = store.softDeleteTenant("acme", NOW.plusSeconds(60)).orElseThrow();

        assertThat(deleted.status()).isEqualTo(TenantStatus.DELETED);
        assertThat(deleted.updatedAt()).isEqualTo(NOW.plusSeconds(60));
        assertThat(store.findTenant("acme")).contains(deleted);
        assertThat(store.memberships("acme")).hasSize(1);
        assertThat(store.auditTrail("acme")).hasSize(1);
        assertThat(store.softDeleteTenant("unknown", NOW)).isEmpty();
    }

    @Test
    @DisplayName("should hold one membership per tenant and user")
    void shouldUpsertMemberships() {
        store.upsertMembership(new TenantMembership("acme", "bob", TenantRole.VIEWER, NOW, NOW));
        store.upsertMembership(new TenantMembership("acme", "bob", TenantRole.MEMBER, NOW, NOW.plusSeconds(1)));
        store.upsertMembership(new TenantMembership("globex", "bob", TenantRole.VIEWER, NOW, NOW));

        assertThat(store.memberships("acme")).extracting(TenantMembership::role).containsExactly(TenantRole.MEMBER);
        assertThat(store.membershipsOf("bob")).extracting(TenantMembership::tenantId)
                .containsExactly("acme", "globex");
        assertThat(store.removeMembership("acme", "bob")).isTrue();
        assertThat(store.removeMembership("acme", "bob")).isFalse();
        assertThat(store.removeMembership("initech", "bob")).isFalse();
    }

    @Test
    @DisplayName("should accept concurrent audit appends without losing records")
    void shouldAppendConcurrently() throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        for (int i = 0; i < 400; i++) {
            String id = "r" + i;
            pool.submit(() -> store.appendAudit(
                    new AuditRecord(id, "acme", "alice", "process", AuditOutcome.SUCCESS, NOW, null)));
        }
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        List<AuditRecord> trail = store.auditTrail("acme");
        assertThat(trail).hasSize(400);
        assertThat(trail).extracting(AuditRecord::recordId).doesNotHaveDuplicates();
    }
}
