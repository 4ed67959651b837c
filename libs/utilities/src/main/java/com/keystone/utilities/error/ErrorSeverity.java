package com.keystone.utilities.error;

/**
 * How bad a handled error is; decides the log level.
 */
public enum ErrorSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
