package com.warden.security.tenant;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryTenantDirectory implements TenantDirectory {

    private final Map<UUID, Tenant> tenants = new ConcurrentHashMap<>();

    @Override
    public Optional<Tenant> findById(UUID tenantId) {
        return Optional.ofNullable(tenants.get(tenantId));
    }

    @Override
    public Optional<Tenant> findBySlug(String slug) {
        if (slug == null) {
            return Optional.empty();
        }
        String normalized = slug.toLowerCase(Locale.ROOT);
        return tenants.values().stream()
                .filter(t -> t.slug().toLowerCase(Locale.ROOT).equals(normalized))
                .findFirst();
    }

    @Override
    public void save(Tenant tenant) {
        findBySlug(tenant.slug())
                .filter(existing -> !existing.id().equals(tenant.id()))
                .ifPresent(existing -> {
                    throw new IllegalArgumentException("Tenant slug already in use: " + tenant.slug());
                });
        tenants.put(tenant.id(), tenant);
    }
}
