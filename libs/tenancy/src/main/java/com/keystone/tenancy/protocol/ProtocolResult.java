package com.keystone.tenancy.protocol;

import com.keystone.container.UtilityUnavailableException;
import com.keystone.tenancy.TenantException;
import com.keystone.utilities.UtilityNames;
import java.util.Optional;

/**
 * Outcome of a tenant-scoped protocol call.
 *
 * @param phase   terminal phase: COMPLETED, DENIED or ERRORED
 * @param value   result of a COMPLETED call (may be null for void operations)
 * @param error   why the call did not complete; null when COMPLETED
 * @param message human-readable detail; null when COMPLETED
 * @param <T>     result type
 */
public record ProtocolResult<T>(CallPhase phase, T value, ProtocolError error, String message) {

    public ProtocolResult {
        if (phase == null || !phase.isTerminal()) {
            throw new IllegalArgumentException("phase must be terminal, got " + phase);
        }
        if (phase != CallPhase.COMPLETED && error == null) {
            throw new IllegalArgumentException("error must be set for " + phase);
        }
    }

    public static <T> ProtocolResult<T> completed(T value) {
        return new ProtocolResult<>(CallPhase.COMPLETED, value, null, null);
    }

    public static <T> ProtocolResult<T> denied(String message) {
        return new ProtocolResult<>(CallPhase.DENIED, null, ProtocolError.ACCESS_DENIED, message);
    }

    public static <T> ProtocolResult<T> errored(ProtocolError error, String message) {
        return new ProtocolResult<>(CallPhase.ERRORED, null, error, message);
    }

    public boolean isCompleted() {
        return phase == CallPhase.COMPLETED;
    }

    public boolean isDenied() {
        return phase == CallPhase.DENIED;
    }

    public boolean isErrored() {
        return phase == CallPhase.ERRORED;
    }

    public Optional<T> valueIfCompleted() {
        return isCompleted() ? Optional.ofNullable(value) : Optional.empty();
    }

    /**
     * Returns the value of a completed call, or throws the typed error of a failed one.
     *
     * @throws TenantException             for denied calls and tenant errors
     * @throws UtilityUnavailableException if the tenancy utility was unavailable
     * @throws IllegalStateException       for internal errors
     */
    public T orElseThrow() {
        if (isCompleted()) {
            return value;
        }
        if (error == ProtocolError.UTILITY_UNAVAILABLE) {
            throw new UtilityUnavailableException(UtilityNames.TENANT, null, message);
        }
        TenantException.Kind kind = error.tenantKind();
        if (kind == null) {
            throw new IllegalStateException(message);
        }
        throw new TenantException(kind, null, message);
    }
}
