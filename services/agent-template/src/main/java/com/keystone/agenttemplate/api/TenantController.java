package com.keystone.agenttemplate.api;

import static com.keystone.agenttemplate.api.AgentController.USER_HEADER;

import com.keystone.agent.AgentServiceBase;
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
import com.keystone.tenancy.protocol.TenantProtocolEnforcer;
import com.keystone.utilities.UtilityNames;
import com.keystone.utilities.security.CallerContext;
import com.keystone.utilities.security.SecurityUtility;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Tenant administration over the agent's tenant protocol. Protocol errors surface as
 * {@code TenantException} and are mapped by the global exception handler.
 */
@RestController
@RequestMapping("/api/v1/tenants")
public class TenantController {

    private final AgentServiceBase agent;

    public TenantController(AgentServiceBase agent) {
        this.agent = agent;
    }

    public record CreateTenantRequest(@NotBlank String tenantId, @NotBlank String name, String type,
                                      Set<String> features, Integer maxUsers) {

        TenantSpec toSpec() {
            return new TenantSpec(tenantId, name, type == null ? null : TenantType.fromString(type)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown tenant type '" + type + "'")), features,
                    maxUsers, null);
        }
    }

    public record UpdateTenantRequest(String name, String status, Integer maxUsers, Map<String, String> metadata) {

        TenantPatch toPatch() {
            return new TenantPatch(name, status == null ? null : parseStatus(status), maxUsers, metadata);
        }

        private static TenantStatus parseStatus(String status) {
            try {
                return TenantStatus.valueOf(status.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown tenant status '" + status + "'", e);
            }
        }
    }

    public record MemberRequest(@NotBlank String userId, String role) {
    }

    @PostMapping
    public ResponseEntity<Tenant> create(@RequestHeader(USER_HEADER) String userId,
                                         @Valid @RequestBody CreateTenantRequest request) {
        Tenant tenant = tenants().createTenant(caller(userId), request.toSpec()).orElseThrow();
        return ResponseEntity.status(HttpStatus.CREATED).body(tenant);
    }

    @GetMapping
    public List<Tenant> list(@RequestHeader(USER_HEADER) String userId) {
        return tenants().listTenants(caller(userId), TenantFilter.all()).orElseThrow();
    }

    @GetMapping("/{tenantId}")
    public ResponseEntity<TenantContext> get(@RequestHeader(USER_HEADER) String userId,
                                             @PathVariable String tenantId) {
        return ResponseEntity.of(tenants().getTenantContext(caller(userId), tenantId).orElseThrow());
    }

    @PatchMapping("/{tenantId}")
    public Tenant update(@RequestHeader(USER_HEADER) String userId, @PathVariable String tenantId,
                         @RequestBody UpdateTenantRequest request) {
        return tenants().updateTenant(caller(userId), tenantId, request.toPatch()).orElseThrow();
    }

    @DeleteMapping("/{tenantId}")
    public Tenant delete(@RequestHeader(USER_HEADER) String userId, @PathVariable String tenantId) {
        return tenants().deleteTenant(caller(userId), tenantId).orElseThrow();
    }

    @GetMapping("/{tenantId}/members")
    public List<TenantMembership> members(@RequestHeader(USER_HEADER) String userId,
                                          @PathVariable String tenantId) {
        return tenants().getTenantUsers(caller(userId), tenantId).orElseThrow();
    }

    @PutMapping("/{tenantId}/members")
    public TenantMembership addMember(@RequestHeader(USER_HEADER) String userId, @PathVariable String tenantId,
                                      @Valid @RequestBody MemberRequest request) {
        TenantRole role = request.role() == null ? TenantRole.MEMBER : TenantRole.fromString(request.role())
                .orElseThrow(() -> new IllegalArgumentException("Unknown tenant role '" + request.role() + "'"));
        return tenants().addUserToTenant(caller(userId), tenantId, request.userId(), role).orElseThrow();
    }

    @DeleteMapping("/{tenantId}/members/{memberId}")
    public ResponseEntity<Void> removeMember(@RequestHeader(USER_HEADER) String userId,
                                             @PathVariable String tenantId, @PathVariable String memberId) {
        boolean removed = tenants().removeUserFromTenant(caller(userId), tenantId, memberId).orElseThrow();
        return removed ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    @PutMapping("/{tenantId}/features/{feature}")
    public Tenant grantFeature(@RequestHeader(USER_HEADER) String userId, @PathVariable String tenantId,
                               @PathVariable String feature) {
        return tenants().grantTenantFeature(caller(userId), tenantId, feature).orElseThrow();
    }

    @DeleteMapping("/{tenantId}/features/{feature}")
    public Tenant revokeFeature(@RequestHeader(USER_HEADER) String userId, @PathVariable String tenantId,
                                @PathVariable String feature) {
        return tenants().revokeTenantFeature(caller(userId), tenantId, feature).orElseThrow();
    }

    @GetMapping("/{tenantId}/usage")
    public UsageStats usage(@RequestHeader(USER_HEADER) String userId, @PathVariable String tenantId) {
        return tenants().getTenantUsageStats(caller(userId), tenantId).orElseThrow();
    }

    @GetMapping("/{tenantId}/health")
    public TenantHealth health(@RequestHeader(USER_HEADER) String userId, @PathVariable String tenantId) {
        return tenants().getTenantHealthStatus(caller(userId), tenantId).orElseThrow();
    }

    private TenantProtocolEnforcer tenants() {
        return agent.tenants();
    }

    private CallerContext caller(String userId) {
        return tenants().container().findUtility(UtilityNames.SECURITY, SecurityUtility.class)
                .map(security -> security.resolveCaller(userId, List.of()))
                .orElseGet(() -> CallerContext.user(userId));
    }
}
