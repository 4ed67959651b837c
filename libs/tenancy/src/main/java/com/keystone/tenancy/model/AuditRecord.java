package com.keystone.tenancy.model;

import java.time.Instant;
import java.util.Map;

/**
 * Write-once record of an action performed against a tenant.
 */
public record AuditRecord(
        String recordId,
        String tenantId,
        String userId,
        String action,
        AuditOutcome outcome,
        Instant timestamp,
        Map<String, String> details) {

    public AuditRecord {
        if (recordId == null || recordId.isBlank()) {
            throw new IllegalArgumentException("recordId must not be null or blank");
        }
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("action must not be null or blank");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("outcome must not be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
