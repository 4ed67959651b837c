package com.keystone.utilities.health;

/**
 * Health of one component or of a whole service.
 */
public enum HealthStatus {

    /** Everything is working. */
    HEALTHY,

    /** Something non-critical failed; requests that don't need it are still served. */
    DEGRADED,

    /** A critical component is down. */
    UNHEALTHY;

    /** The worse of two statuses. */
    public HealthStatus worst(HealthStatus other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
