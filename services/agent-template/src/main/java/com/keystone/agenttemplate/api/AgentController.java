package com.keystone.agenttemplate.api;

import com.keystone.agent.AgentCapability;
import com.keystone.agent.AgentRequest;
import com.keystone.agent.AgentResponse;
import com.keystone.agent.AgentServiceBase;
import com.keystone.utilities.logging.CorrelationContext;
import com.keystone.utilities.logging.CorrelationContextHolder;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP transport for the hosted agent. Tenant and user come from the {@code X-Tenant-ID} and
 * {@code X-User-ID} headers set by the gateway.
 */
@RestController
@RequestMapping("/api/v1/agent")
public class AgentController {

    public static final String TENANT_HEADER = "X-Tenant-ID";
    public static final String USER_HEADER = "X-User-ID";
    public static final String ROLES_HEADER = "X-User-Roles";

    private final AgentServiceBase agent;

    public AgentController(AgentServiceBase agent) {
        this.agent = agent;
    }

    @GetMapping
    public Map<String, Object> describe() {
        return Map.of(
                "description", agent.getAgentDescription(),
                "capabilities", agent.getAgentCapabilities().stream().map(AgentCapability::name).toList());
    }

    @PostMapping("/{capability}")
    public ResponseEntity<AgentResponse> invoke(
            @PathVariable String capability,
            @RequestHeader(name = TENANT_HEADER, required = false) String tenantId,
            @RequestHeader(name = USER_HEADER, required = false) String userId,
            @RequestHeader(name = ROLES_HEADER, required = false) String roles,
            @RequestBody(required = false) Map<String, Object> payload) {
        String requestId = CorrelationContextHolder.get().map(CorrelationContext::requestId).orElse(null);
        AgentResponse response = agent.handle(
                new AgentRequest(requestId, capability, tenantId, userId, roles(roles), payload));
        return ResponseEntity.status(statusOf(response)).body(response);
    }

    static HttpStatus statusOf(AgentResponse response) {
        return switch (response.status()) {
            case SUCCESS -> HttpStatus.OK;
            case DENIED -> HttpStatus.FORBIDDEN;
            case ERROR -> switch (response.errorCode()) {
                case "NOT_FOUND", "TENANT_NOT_FOUND", "UNKNOWN_CAPABILITY" -> HttpStatus.NOT_FOUND;
                case "INVALID_REQUEST", "INVALID_ARGUMENT", "TENANT_INVALID_REQUEST" -> HttpStatus.BAD_REQUEST;
                case "UTILITY_UNAVAILABLE" -> HttpStatus.SERVICE_UNAVAILABLE;
                default -> HttpStatus.INTERNAL_SERVER_ERROR;
            };
        };
    }

    private static List<String> roles(String header) {
        if (header == null || header.isBlank()) {
            return List.of();
        }
        return Arrays.stream(header.split(",")).map(String::trim).filter(r -> !r.isEmpty()).toList();
    }
}
