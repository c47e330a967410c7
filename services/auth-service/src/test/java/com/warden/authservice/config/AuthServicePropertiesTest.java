package com.warden.authservice.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.warden.security.tenant.TenantStatus;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AuthServiceProperties")
class AuthServicePropertiesTest {

    private static final String SECRET = "properties-test-secret-0123456789abcdef";

    private static AuthServiceProperties minimal(AuthServiceProperties.Jwt jwt) {
        return new AuthServiceProperties("warden-auth", null, jwt, null, null, null, null, null, null, null);
    }

    @Test
    @DisplayName("applies defaults for every optional value")
    void defaults() {
        var props = minimal(new AuthServiceProperties.Jwt(SECRET, null, null, null, null));

        assertThat(props.environment()).isEqualTo("development");
        assertThat(props.jwt().keyId()).isEqualTo("default");
        assertThat(props.tokenSettings().issuer()).isEqualTo("warden");
        assertThat(props.tokenSettings().accessTokenTtl()).isEqualTo(Duration.ofHours(1));
        assertThat(props.sessionSettings().ttl()).isEqualTo(Duration.ofDays(1));
        assertThat(props.sessionSettings().rememberMeTtl()).isEqualTo(Duration.ofDays(30));
        assertThat(props.sessionSettings().maxConcurrent()).isZero();
        assertThat(props.password().bcryptCost()).isEqualTo(12);
        assertThat(props.authSettings().resetTokenTtl()).isEqualTo(Duration.ofHours(1));
        assertThat(props.authSettings().verificationTokenTtl()).isEqualTo(Duration.ofHours(24));
        assertThat(props.mfa().issuer()).isEqualTo("Warden");
        assertThat(props.tenants()).isEmpty();
    }

    @Test
    @DisplayName("builds a key store with the current and previous keys")
    void signingKeys() {
        var props = minimal(new AuthServiceProperties.Jwt(SECRET, "k2", null,
                Map.of("k1", "previous-secret-0123456789abcdefghij"), null));

        var keys = props.signingKeys();

        assertThat(keys.current().id()).isEqualTo("k2");
        assertThat(keys.find("k1")).isPresent();
    }

    @Test
    @DisplayName("a short secret fails when keys are built")
    void shortSecret() {
        var props = minimal(new AuthServiceProperties.Jwt("too-short", null, null, null, null));

        assertThatThrownBy(props::signingKeys)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("32 bytes");
    }

    @Test
    @DisplayName("tenant seeds default to ACTIVE and carry quotas")
    void tenantSeed() {
        var seed = new AuthServiceProperties.TenantSeed(UUID.randomUUID(), null, "acme", null, null, 10, 3);

        var tenant = seed.toTenant();

        assertThat(tenant.status()).isEqualTo(TenantStatus.ACTIVE);
        assertThat(tenant.organizationName()).isEqualTo("acme");
        assertThat(tenant.quotas().maxUsers()).isEqualTo(10);
        assertThat(tenant.quotas().maxSessionsPerUser()).isEqualTo(3);
    }

    @Test
    @DisplayName("tenant list is copied")
    void tenantsCopied() {
        var seed = new AuthServiceProperties.TenantSeed(UUID.randomUUID(), "Acme", "acme", null, null, 0, 0);
        var props = new AuthServiceProperties("warden-auth", "test",
                new AuthServiceProperties.Jwt(SECRET, null, null, null, null),
                null, null, null, null, null, null, List.of(seed));

        assertThat(props.tenants()).containsExactly(seed);
    }
}
