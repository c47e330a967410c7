package com.warden.security;

import java.util.UUID;

/**
 * Checks that a principal only acts inside the tenant resolved for the current request.
 * <p>
 * A token minted for tenant A presented on a request resolved to tenant B fails here, before
 * any tenant-scoped lookup runs.
 */
public final class TenantIsolationEnforcer {

    private TenantIsolationEnforcer() {
        // utility class
    }

    /**
     * @param principal        the authenticated caller
     * @param resolvedTenantId tenant supplied by tenant resolution for this request
     * @throws TenantMismatchException if the tenants differ
     */
    public static void enforce(AuthenticatedPrincipal principal, UUID resolvedTenantId) {
        if (!principal.tenantId().equals(resolvedTenantId)) {
            throw new TenantMismatchException(principal.tenantId(), resolvedTenantId);
        }
    }
}
