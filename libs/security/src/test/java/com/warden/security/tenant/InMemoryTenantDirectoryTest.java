package com.warden.security.tenant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("InMemoryTenantDirectory")
class InMemoryTenantDirectoryTest {

    private final InMemoryTenantDirectory directory = new InMemoryTenantDirectory();

    private static Tenant tenant(String slug, TenantStatus status) {
        return new Tenant(UUID.randomUUID(), slug + " Inc.", slug, "admin@" + slug + ".test", status, null);
    }

    @Test
    @DisplayName("finds tenants by id and by slug ignoring case")
    void lookup() {
        Tenant acme = tenant("acme", TenantStatus.ACTIVE);
        directory.save(acme);

        assertThat(directory.findById(acme.id())).contains(acme);
        assertThat(directory.findBySlug("ACME")).contains(acme);
        assertThat(directory.findBySlug(null)).isEmpty();
        assertThat(directory.findById(UUID.randomUUID())).isEmpty();
    }

    @Test
    @DisplayName("rejects a slug already used by another tenant")
    void duplicateSlug() {
        directory.save(tenant("acme", TenantStatus.ACTIVE));

        assertThatThrownBy(() -> directory.save(tenant("Acme", TenantStatus.TRIAL)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("slug already in use");
    }

    @Test
    @DisplayName("saving the same tenant again replaces it")
    void update() {
        Tenant acme = tenant("acme", TenantStatus.ACTIVE);
        directory.save(acme);
        Tenant suspended = new Tenant(acme.id(), acme.organizationName(), acme.slug(), acme.adminEmail(),
                TenantStatus.SUSPENDED, acme.quotas());
        directory.save(suspended);

        assertThat(directory.findById(acme.id())).get()
                .extracting(Tenant::status).isEqualTo(TenantStatus.SUSPENDED);
    }

    @Test
    @DisplayName("defaults quotas to unlimited and only ACTIVE and TRIAL accept requests")
    void statusAndQuotas() {
        assertThat(tenant("acme", TenantStatus.ACTIVE).quotas()).isEqualTo(TenantQuotas.unlimited());
        assertThat(TenantStatus.ACTIVE.acceptsRequests()).isTrue();
        assertThat(TenantStatus.TRIAL.acceptsRequests()).isTrue();
        assertThat(TenantStatus.SUSPENDED.acceptsRequests()).isFalse();
        assertThat(TenantStatus.CANCELLED.acceptsRequests()).isFalse();
        assertThatThrownBy(() -> new TenantQuotas(-1, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
