package com.keystone.tenancy.protocol;

/**
 * Phases of one tenant-scoped call. A call moves forward through the first four and ends in
 * exactly one of the last three.
 */
public enum CallPhase {
    UNAUTHENTICATED,
    TENANT_RESOLVED,
    ACCESS_VALIDATED,
    DELEGATED,
    COMPLETED,
    DENIED,
    ERRORED;

    public boolean isTerminal() {
        return this == COMPLETED || this == DENIED || this == ERRORED;
    }
}
