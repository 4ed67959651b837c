package com.keystone.agent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A tenant-scoped request to an agent.
 *
 * @param requestId  correlation ID, generated when absent
 * @param capability name of the capability to run
 * @param tenantId   tenant the request acts in
 * @param userId     authenticated user, or null for an unauthenticated request
 * @param roles      role names asserted by the transport layer
 * @param payload    capability arguments
 */
public record AgentRequest(
        String requestId,
        String capability,
        String tenantId,
        String userId,
        List<String> roles,
        Map<String, Object> payload) {

    public AgentRequest {
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        if (capability == null || capability.isBlank()) {
            throw new IllegalArgumentException("capability must not be null or blank");
        }
        roles = roles == null ? List.of() : List.copyOf(roles);
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static AgentRequest of(String capability, String tenantId, String userId, Map<String, Object> payload) {
        return new AgentRequest(null, capability, tenantId, userId, List.of(), payload);
    }
}
