package com.warden.security.tenant;

/**
 * Lifecycle state of a tenant. Only ACTIVE and TRIAL tenants accept requests.
 */
public enum TenantStatus {
    ACTIVE,
    TRIAL,
    SUSPENDED,
    CANCELLED;

    public boolean acceptsRequests() {
        return this == ACTIVE || this == TRIAL;
    }
}
