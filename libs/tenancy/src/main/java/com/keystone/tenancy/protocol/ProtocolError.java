package com.keystone.tenancy.protocol;

import com.keystone.tenancy.TenantException;

/**
 * Why a protocol call ended ERRORED or DENIED.
 */
public enum ProtocolError {
    NOT_FOUND,
    DUPLICATE_TENANT,
    ACCESS_DENIED,
    USER_LIMIT_EXCEEDED,
    INVALID_REQUEST,
    UTILITY_UNAVAILABLE,
    INTERNAL_ERROR;

    public static ProtocolError of(TenantException.Kind kind) {
        return switch (kind) {
            case NOT_FOUND -> NOT_FOUND;
            case DUPLICATE_TENANT -> DUPLICATE_TENANT;
            case ACCESS_DENIED -> ACCESS_DENIED;
            case USER_LIMIT_EXCEEDED -> USER_LIMIT_EXCEEDED;
            case INVALID_REQUEST -> INVALID_REQUEST;
        };
    }

    /** The matching tenant error kind, or null for container-level errors. */
    public TenantException.Kind tenantKind() {
        return switch (this) {
            case NOT_FOUND -> TenantException.Kind.NOT_FOUND;
            case DUPLICATE_TENANT -> TenantException.Kind.DUPLICATE_TENANT;
            case ACCESS_DENIED -> TenantException.Kind.ACCESS_DENIED;
            case USER_LIMIT_EXCEEDED -> TenantException.Kind.USER_LIMIT_EXCEEDED;
            case INVALID_REQUEST -> TenantException.Kind.INVALID_REQUEST;
            case UTILITY_UNAVAILABLE, INTERNAL_ERROR -> null;
        };
    }
}
