package com.warden.security;

import java.util.UUID;

/**
 * Thrown when a principal of one tenant attempts to act in another tenant.
 * The message names both tenants and is meant for logs only, never for responses.
 */
public class TenantMismatchException extends RuntimeException {

    private final UUID principalTenantId;
    private final UUID requestTenantId;

    public TenantMismatchException(UUID principalTenantId, UUID requestTenantId) {
        super("Tenant mismatch: principal tenant '%s' cannot act in tenant '%s'"
                .formatted(principalTenantId, requestTenantId));
        this.principalTenantId = principalTenantId;
        this.requestTenantId = requestTenantId;
    }

    public UUID principalTenantId() {
        return principalTenantId;
    }

    public UUID requestTenantId() {
        return requestTenantId;
    }
}
