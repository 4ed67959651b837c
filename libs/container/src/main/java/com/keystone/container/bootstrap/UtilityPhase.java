package com.keystone.container.bootstrap;

/**
 * Initialization phase of a single utility within one container generation.
 */
public enum UtilityPhase {
    PENDING,
    INITIALIZING,
    READY,
    FAILED
}
