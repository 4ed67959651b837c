package com.keystone.tenancy.model;

public enum AuditOutcome {
    SUCCESS,
    DENIED,
    FAILURE
}
