package com.keystone.agent;

/**
 * Identity of an agent service.
 *
 * @param agentName unique agent name
 * @param version   agent version
 * @param summary   what the agent does
 */
public record AgentDescription(String agentName, String version, String summary) {

    public AgentDescription {
        if (agentName == null || agentName.isBlank()) {
            throw new IllegalArgumentException("agentName must not be null or blank");
        }
        if (version == null || version.isBlank()) {
            version = "0.0.0";
        }
        if (summary == null) {
            summary = "";
        }
    }
}
