package com.keystone.container.bootstrap;

/**
 * State of one utility, as reported by the health summary.
 *
 * @param phase       current phase
 * @param failureKind failure reason, only set when {@code phase} is FAILED
 * @param detail      human-readable failure detail, only set when {@code phase} is FAILED
 */
public record UtilityState(UtilityPhase phase, FailureKind failureKind, String detail) {

    public static final UtilityState PENDING = new UtilityState(UtilityPhase.PENDING, null, null);
    public static final UtilityState INITIALIZING = new UtilityState(UtilityPhase.INITIALIZING, null, null);
    public static final UtilityState READY = new UtilityState(UtilityPhase.READY, null, null);

    public UtilityState {
        if (phase == null) {
            throw new IllegalArgumentException("phase must not be null");
        }
        if (phase == UtilityPhase.FAILED && failureKind == null) {
            throw new IllegalArgumentException("failureKind must be set for a FAILED state");
        }
        if (phase != UtilityPhase.FAILED && failureKind != null) {
            throw new IllegalArgumentException("failureKind is only allowed for a FAILED state");
        }
    }

    /** A FAILED state with the given reason. */
    public static UtilityState failed(FailureKind kind, String detail) {
        return new UtilityState(UtilityPhase.FAILED, kind, detail);
    }

    public boolean isReady() {
        return phase == UtilityPhase.READY;
    }

    public boolean isFailed() {
        return phase == UtilityPhase.FAILED;
    }

    @Override
    public String toString() {
        return isFailed() ? "FAILED(" + failureKind + ")" : phase.name();
    }
}
