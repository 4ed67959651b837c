package com.keystone.utilities;

/**
 * Registry names of the standard platform utilities.
 */
public final class UtilityNames {

    public static final String CONFIG = "config";
    public static final String LOGGER = "logger";
    public static final String HEALTH = "health";
    public static final String TELEMETRY = "telemetry";
    public static final String SECURITY = "security";
    public static final String TENANT = "tenant";
    public static final String VALIDATION = "validation";
    public static final String SERIALIZATION = "serialization";
    public static final String ERROR_HANDLER = "error_handler";

    private UtilityNames() {
        // constants
    }
}
