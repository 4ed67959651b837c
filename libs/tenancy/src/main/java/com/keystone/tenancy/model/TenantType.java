package com.keystone.tenancy.model;

import java.util.Optional;

/**
 * Tenant tiers. The tier selects the default user limit and feature set applied at creation.
 */
public enum TenantType {

    INDIVIDUAL("individual"),
    ORGANIZATION("organization"),
    ENTERPRISE("enterprise");

    private final String value;

    TenantType(String value) {
        this.value = value;
    }

    /** The canonical string representation. */
    public String value() {
        return value;
    }

    /** Looks up a tier by canonical value or enum name, ignoring case. */
    public static Optional<TenantType> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (TenantType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
