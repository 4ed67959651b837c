package com.keystone.tenancy.model;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Usage aggregated from a tenant's audit trail and retained memberships.
 *
 * @param lastActive timestamp of the newest audit record, or null when there is none
 */
public record UsageStats(
        String tenantId,
        int currentUsers,
        int maxUsers,
        double usagePercentage,
        long totalActions,
        long successfulActions,
        long deniedActions,
        long failedActions,
        Map<String, Long> actionsByType,
        Instant lastActive) {

    public UsageStats {
        actionsByType = actionsByType == null ? Map.of() : Map.copyOf(actionsByType);
    }

    public Optional<Instant> lastActiveAt() {
        return Optional.ofNullable(lastActive);
    }
}
