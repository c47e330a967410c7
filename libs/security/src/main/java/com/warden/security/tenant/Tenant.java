package com.warden.security.tenant;

import java.util.Objects;
import java.util.UUID;

/**
 * An isolated customer organisation, the root of data partitioning.
 */
public record Tenant(
        UUID id,
        String organizationName,
        String slug,
        String adminEmail,
        TenantStatus status,
        TenantQuotas quotas
) {

    public Tenant {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(status, "status");
        if (slug == null || slug.isBlank()) {
            throw new IllegalArgumentException("slug must not be null or blank");
        }
        if (quotas == null) {
            quotas = TenantQuotas.unlimited();
        }
    }
}
