package com.keystone.agent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of an agent request.
 *
 * @param requestId correlation ID of the request
 * @param status    outcome
 * @param payload   capability result; empty unless SUCCESS
 * @param errorCode machine-readable code; null on SUCCESS
 * @param message   human-readable detail; null on SUCCESS
 */
public record AgentResponse(String requestId, Status status, Map<String, Object> payload, String errorCode,
                            String message) {

    public enum Status {
        SUCCESS,
        DENIED,
        ERROR
    }

    public AgentResponse {
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static AgentResponse success(String requestId, Map<String, Object> payload) {
        return new AgentResponse(requestId, Status.SUCCESS, payload, null, null);
    }

    public static AgentResponse denied(String requestId, String message) {
        return new AgentResponse(requestId, Status.DENIED, null, "ACCESS_DENIED", message);
    }

    public static AgentResponse error(String requestId, String errorCode, String message) {
        return new AgentResponse(requestId, Status.ERROR, null, errorCode, message);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
