package com.keystone.container;

/**
 * Lifecycle of a {@link DIContainer}.
 */
public enum ContainerLifecycleState {
    CREATED,
    INITIALIZING,
    RUNNING,
    STOPPING,
    STOPPED,
    /** The last initialize hit an invalid or cyclic dependency graph. */
    FAILED
}
