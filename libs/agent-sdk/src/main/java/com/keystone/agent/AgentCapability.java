package com.keystone.agent;

import java.util.Optional;

/**
 * One operation an agent offers.
 *
 * @param name            unique capability name, used as the request operation
 * @param description     human-readable summary
 * @param requiredFeature tenant feature flag the capability needs, or null when ungated
 */
public record AgentCapability(String name, String description, String requiredFeature) {

    public AgentCapability {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (description == null) {
            description = "";
        }
        if (requiredFeature != null && requiredFeature.isBlank()) {
            requiredFeature = null;
        }
    }

    public static AgentCapability of(String name, String description) {
        return new AgentCapability(name, description, null);
    }

    public AgentCapability requiringFeature(String feature) {
        return new AgentCapability(name, description, feature);
    }

    public Optional<String> feature() {
        return Optional.ofNullable(requiredFeature);
    }
}
