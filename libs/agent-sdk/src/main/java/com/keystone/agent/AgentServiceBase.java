package com.keystone.agent;

import com.keystone.container.DIContainer;
import com.keystone.tenancy.model.AuditOutcome;
import com.keystone.tenancy.model.TenantContext;
import com.keystone.tenancy.protocol.ProtocolError;
import com.keystone.tenancy.protocol.ProtocolResult;
import com.keystone.tenancy.protocol.TenantProtocolEnforcer;
import com.keystone.utilities.UtilityNames;
import com.keystone.utilities.error.ErrorHandlerUtility;
import com.keystone.utilities.error.ErrorReport;
import com.keystone.utilities.logging.CorrelationContext;
import com.keystone.utilities.logging.CorrelationContextHolder;
import com.keystone.utilities.security.CallerContext;
import com.keystone.utilities.security.SecurityUtility;
import com.keystone.utilities.telemetry.TelemetryUtility;
import io.opentelemetry.api.trace.SpanKind;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatch glue shared by agent services. Subclasses implement the capability set; callers go
 * through {@link #handle}, which:
 * <ol>
 *   <li>resolves the capability and the caller (platform-admin status comes from the security
 *       utility's configuration);</li>
 *   <li>resolves the tenant through the protocol enforcer, which validates access;</li>
 *   <li>checks the capability's feature against the same tenant snapshot;</li>
 *   <li>runs {@link #processRequest} with the correlation context in MDC, inside a server span
 *       when telemetry is ready;</li>
 *   <li>audits the outcome.</li>
 * </ol>
 * Exceptions from {@code processRequest} are classified by the error handler utility and become
 * {@link AgentResponse.Status#ERROR} responses.
 */
public abstract class AgentServiceBase implements AgentService {

    private static final Logger log = LoggerFactory.getLogger(AgentServiceBase.class);

    public static final String ATTR_AGENT = "keystone.agent";
    static final String REQUESTS_METRIC = "keystone.agent.requests";

    private final DIContainer container;
    private final TenantProtocolEnforcer tenants;

    protected AgentServiceBase(DIContainer container) {
        this(container, new TenantProtocolEnforcer(container));
    }

    protected AgentServiceBase(DIContainer container, TenantProtocolEnforcer tenants) {
        if (container == null) {
            throw new IllegalArgumentException("container must not be null");
        }
        if (tenants == null) {
            throw new IllegalArgumentException("tenants must not be null");
        }
        this.container = container;
        this.tenants = tenants;
    }

    @Override
    public final TenantProtocolEnforcer tenants() {
        return tenants;
    }

    protected final DIContainer container() {
        return container;
    }

    /** A ready utility of this service's container. */
    protected final <T> T utility(String name, Class<T> type) {
        return container.getUtility(name, type);
    }

    /**
     * Validates and runs one request. Never throws.
     */
    public final AgentResponse handle(AgentRequest request) {
        String requestId = request.requestId();
        Optional<AgentCapability> capability = getAgentCapabilities().stream()
                .filter(c -> c.name().equals(request.capability()))
                .findFirst();
        if (capability.isEmpty()) {
            return AgentResponse.error(requestId, "UNKNOWN_CAPABILITY",
                    "Agent '%s' has no capability '%s'".formatted(agentName(), request.capability()));
        }
        if (request.tenantId() == null || request.tenantId().isBlank()) {
            return AgentResponse.error(requestId, ProtocolError.INVALID_REQUEST.name(), "tenantId is required");
        }
        if (request.userId() == null || request.userId().isBlank()) {
            return deny(request, "request is not authenticated");
        }

        CallerContext caller = resolveCaller(request);
        ProtocolResult<Optional<TenantContext>> resolved = tenants.getTenantContext(caller, request.tenantId());
        if (resolved.isDenied()) {
            return deny(request, resolved.message());
        }
        if (resolved.isErrored()) {
            return AgentResponse.error(requestId, resolved.error().name(), resolved.message());
        }
        Optional<TenantContext> tenant = resolved.value();
        if (tenant.isEmpty()) {
            return AgentResponse.error(requestId, ProtocolError.NOT_FOUND.name(),
                    "Tenant '%s' not found".formatted(request.tenantId()));
        }
        Optional<String> feature = capability.get().feature();
        if (feature.isPresent() && !tenant.get().hasFeature(feature.get())) {
            return deny(request, "tenant '%s' is not entitled to '%s'".formatted(request.tenantId(), feature.get()));
        }

        CorrelationContext context = new CorrelationContext(requestId, container.serviceName(), request.tenantId(),
                request.userId(), request.capability());
        AgentResponse response = CorrelationContextHolder.callWithContext(context,
                () -> invoke(request, capability.get()));
        tenants.auditTenantAction(request.tenantId(), request.userId(), request.capability(),
                response.isSuccess() ? AuditOutcome.SUCCESS : AuditOutcome.FAILURE);
        count(request, response);
        return response;
    }

    private AgentResponse invoke(AgentRequest request, AgentCapability capability) {
        Optional<TelemetryUtility> telemetry = container.findUtility(UtilityNames.TELEMETRY, TelemetryUtility.class);
        AgentResponse response;
        try {
            response = telemetry.isPresent()
                    ? telemetry.get().spans().inSpan("agent." + capability.name(), SpanKind.SERVER,
                            Map.of(ATTR_AGENT, agentName()), () -> processRequest(request))
                    : processRequest(request);
        } catch (RuntimeException e) {
            return failure(request, e);
        }
        if (response == null) {
            log.error("Agent '{}' returned no response for '{}'", agentName(), request.capability());
            return AgentResponse.error(request.requestId(), ErrorHandlerUtility.INTERNAL_ERROR,
                    "capability '%s' returned no response".formatted(request.capability()));
        }
        log.debug("Agent '{}' answered '{}' with {}", agentName(), request.capability(), response.status());
        return response;
    }

    private AgentResponse failure(AgentRequest request, RuntimeException e) {
        String operation = "agent." + request.capability();
        Optional<ErrorHandlerUtility> errors = container.findUtility(UtilityNames.ERROR_HANDLER,
                ErrorHandlerUtility.class);
        if (errors.isPresent()) {
            ErrorReport report = errors.get().handle(e, operation);
            return AgentResponse.error(request.requestId(), report.errorCode(), report.message());
        }
        log.error("{} failed", operation, e);
        return AgentResponse.error(request.requestId(), ErrorHandlerUtility.INTERNAL_ERROR,
                e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
    }

    private AgentResponse deny(AgentRequest request, String reason) {
        log.info("Denied '{}' on tenant '{}' for user '{}': {}", request.capability(), request.tenantId(),
                request.userId(), reason);
        tenants.auditTenantAction(request.tenantId(), request.userId(), request.capability(), AuditOutcome.DENIED);
        AgentResponse response = AgentResponse.denied(request.requestId(), reason);
        count(request, response);
        return response;
    }

    private CallerContext resolveCaller(AgentRequest request) {
        return container.findUtility(UtilityNames.SECURITY, SecurityUtility.class)
                .map(security -> security.resolveCaller(request.userId(), request.roles()))
                .orElseGet(() -> CallerContext.user(request.userId()));
    }

    private void count(AgentRequest request, AgentResponse response) {
        container.findUtility(UtilityNames.TELEMETRY, TelemetryUtility.class).ifPresent(telemetry -> telemetry.metrics()
                .counter(REQUESTS_METRIC, "Agent requests by capability and status",
                        "capability", request.capability(), "status", response.status().name())
                .increment());
    }

    private String agentName() {
        return getAgentDescription().agentName();
    }
}
