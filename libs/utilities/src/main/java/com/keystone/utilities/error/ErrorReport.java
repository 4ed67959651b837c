package com.keystone.utilities.error;

import java.time.Instant;
import java.util.Map;

/**
 * Normalised description of a handled error.
 *
 * @param errorCode stable machine-readable code (e.g., "UTILITY_UNAVAILABLE")
 * @param message   human-readable message
 * @param operation operation that failed
 * @param severity  severity used for logging and alerting
 * @param timestamp when the error was handled
 * @param context   extra key-value context (tenant, user, exception type)
 */
public record ErrorReport(
        String errorCode,
        String message,
        String operation,
        ErrorSeverity severity,
        Instant timestamp,
        Map<String, String> context
) {

    public ErrorReport {
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode must not be null or blank");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity must not be null");
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
