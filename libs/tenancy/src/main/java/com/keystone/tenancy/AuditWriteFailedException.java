package com.keystone.tenancy;

/**
 * An audit record could not be appended. Callers on the protocol path log and absorb it.
 */
public class AuditWriteFailedException extends RuntimeException {

    private final String tenantId;
    private final String action;

    public AuditWriteFailedException(String tenantId, String action, Throwable cause) {
        super("Failed to audit '%s' on tenant '%s'".formatted(action, tenantId), cause);
        this.tenantId = tenantId;
        this.action = action;
    }

    public String tenantId() {
        return tenantId;
    }

    public String action() {
        return action;
    }
}
