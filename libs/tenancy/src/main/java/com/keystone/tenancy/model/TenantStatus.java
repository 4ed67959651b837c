package com.keystone.tenancy.model;

/**
 * Lifecycle status of a tenant. Only ACTIVE tenants grant access or features; DELETED is a soft
 * delete and is never reversed.
 */
public enum TenantStatus {
    ACTIVE,
    SUSPENDED,
    DELETED
}
