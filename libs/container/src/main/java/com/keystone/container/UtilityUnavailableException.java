package com.keystone.container;

import com.keystone.container.bootstrap.UtilityState;
import java.util.Optional;

/**
 * Thrown when a utility is requested that is not ready. Callers treat it as a degraded-mode
 * signal, not a fatal error.
 */
public class UtilityUnavailableException extends RuntimeException {

    private final String utilityName;
    private final transient UtilityState state;

    public UtilityUnavailableException(String utilityName, UtilityState state, String message) {
        super(message);
        this.utilityName = utilityName;
        this.state = state;
    }

    public String utilityName() {
        return utilityName;
    }

    /** State of the utility when it was requested; empty for undeclared utilities. */
    public Optional<UtilityState> state() {
        return Optional.ofNullable(state);
    }
}
