package com.keystone.container.bootstrap;

/**
 * Why a utility ended in {@link UtilityPhase#FAILED}.
 */
public enum FailureKind {

    /** The utility's own factory threw or returned nothing. */
    CONSTRUCTION_FAILED,

    /** A declared dependency (directly or transitively) did not become ready. */
    DEPENDENCY_FAILED,

    /** A required configuration key was absent. */
    MISSING_REQUIRED,

    /** A configuration value could not be coerced to its declared type. */
    TYPE_MISMATCH,

    /** The bootstrap deadline expired before the utility was constructed. */
    TIMEOUT
}
