package com.warden.authservice.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.warden.observability.CorrelationContext;
import com.warden.observability.CorrelationContextHolder;
import com.warden.security.InvalidCredentialsException;
import com.warden.security.tenant.InMemoryTenantDirectory;
import com.warden.security.tenant.Tenant;
import com.warden.security.tenant.TenantQuotas;
import com.warden.security.tenant.TenantStatus;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

@DisplayName("TenantResolver")
class TenantResolverTest {

    private final InMemoryTenantDirectory tenants = new InMemoryTenantDirectory();
    private final TenantResolver resolver = new TenantResolver(tenants);
    private final UUID active = UUID.randomUUID();
    private final UUID suspended = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        tenants.save(new Tenant(active, "Acme", "acme", null, TenantStatus.ACTIVE, TenantQuotas.unlimited()));
        tenants.save(new Tenant(suspended, "Initech", "initech", null, TenantStatus.SUSPENDED, TenantQuotas.unlimited()));
    }

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    private static MockHttpServletRequest withHeader(String value) {
        var request = new MockHttpServletRequest();
        if (value != null) {
            request.addHeader(TenantResolver.TENANT_HEADER, value);
        }
        return request;
    }

    @Test
    @DisplayName("resolves an active tenant and tags the correlation context")
    void resolves() {
        CorrelationContextHolder.set(CorrelationContext.start("corr", null));

        assertThat(resolver.resolve(withHeader(active.toString()))).isEqualTo(active);
        assertThat(CorrelationContextHolder.get().map(CorrelationContext::tenantId)).contains(active.toString());
    }

    @Test
    @DisplayName("missing or malformed header is a client error")
    void badHeader() {
        assertThatThrownBy(() -> resolver.resolve(withHeader(null)))
                .isInstanceOf(TenantResolutionException.class);
        assertThatThrownBy(() -> resolver.resolve(withHeader("acme")))
                .isInstanceOf(TenantResolutionException.class)
                .hasMessageContaining("UUID");
    }

    @Test
    @DisplayName("unknown and suspended tenants are rejected as bad credentials")
    void unavailable() {
        assertThatThrownBy(() -> resolver.resolve(withHeader(UUID.randomUUID().toString())))
                .isInstanceOf(InvalidCredentialsException.class);
        assertThatThrownBy(() -> resolver.resolve(withHeader(suspended.toString())))
                .isInstanceOf(InvalidCredentialsException.class);
    }

    @Test
    @DisplayName("caches the tenant on the request")
    void caches() {
        var request = withHeader(active.toString());
        resolver.resolve(request);
        request.removeHeader(TenantResolver.TENANT_HEADER);

        assertThat(resolver.resolve(request)).isEqualTo(active);
    }
}
