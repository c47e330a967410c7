package com.warden.security.tenant;

import java.util.Optional;
import java.util.UUID;

/**
 * Lookup of tenants. Backs tenant resolution at the edge; the authentication core only reads
 * quotas from it.
 */
public interface TenantDirectory {

    Optional<Tenant> findById(UUID tenantId);

    Optional<Tenant> findBySlug(String slug);

    void save(Tenant tenant);
}
