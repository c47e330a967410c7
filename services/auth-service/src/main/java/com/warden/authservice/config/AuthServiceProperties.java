package com.warden.authservice.config;

import com.warden.security.auth.AuthSettings;
import com.warden.security.password.PasswordHasher;
import com.warden.security.session.SessionSettings;
import com.warden.security.tenant.Tenant;
import com.warden.security.tenant.TenantQuotas;
import com.warden.security.tenant.TenantStatus;
import com.warden.security.token.SigningKey;
import com.warden.security.token.StaticSigningKeyStore;
import com.warden.security.token.TokenSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration of the auth service, bound from {@code warden.auth.*}.
 *
 * <pre>
 * warden:
 *   auth:
 *     name: warden-auth
 *     environment: production
 *     jwt:
 *       secret: ${WARDEN_JWT_SECRET}
 *       key-id: k-2024-01
 *       previous-keys:
 *         k-2023-07: ${WARDEN_JWT_PREVIOUS_SECRET}
 *     session:
 *       max-concurrent: 5
 *     tenants:
 *       - id: 6f1c...
 *         slug: acme
 * </pre>
 *
 * <p>Missing optional values fall back to the core defaults. An invalid value fails startup.
 *
 * @param name service name, used as the {@code service} metric tag
 * @param environment deployment environment, {@code development} when absent
 * @param resetTokenTtl lifetime of password reset tokens
 * @param verificationTokenTtl lifetime of email verification tokens
 * @param tenants tenants registered in the in-memory directory at startup
 */
@ConfigurationProperties(prefix = "warden.auth")
@Validated
public record AuthServiceProperties(
        @NotBlank String name,
        String environment,
        @Valid @NotNull Jwt jwt,
        @Valid Session session,
        @Valid Password password,
        @Valid Mfa mfa,
        @Valid Audit audit,
        Duration resetTokenTtl,
        Duration verificationTokenTtl,
        @Valid List<TenantSeed> tenants) {

    public AuthServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (session == null) {
            session = new Session(null, null, 0);
        }
        if (password == null) {
            password = new Password(0, null);
        }
        if (mfa == null) {
            mfa = new Mfa(null);
        }
        if (audit == null) {
            audit = new Audit(0, 0);
        }
        if (resetTokenTtl == null) {
            resetTokenTtl = AuthSettings.defaults().resetTokenTtl();
        }
        if (verificationTokenTtl == null) {
            verificationTokenTtl = AuthSettings.defaults().verificationTokenTtl();
        }
        tenants = tenants == null ? List.of() : List.copyOf(tenants);
    }

    /**
     * @param secret HMAC secret of the current signing key, at least 32 bytes
     * @param keyId key id written to the {@code kid} header
     * @param issuer {@code iss} claim
     * @param previousKeys retired keys by id, accepted for verification only
     * @param accessTokenTtl access token lifetime
     */
    public record Jwt(
            @NotBlank String secret,
            String keyId,
            String issuer,
            Map<String, String> previousKeys,
            Duration accessTokenTtl) {

        public Jwt {
            if (keyId == null || keyId.isBlank()) {
                keyId = "default";
            }
            if (issuer == null || issuer.isBlank()) {
                issuer = TokenSettings.defaults().issuer();
            }
            previousKeys = previousKeys == null ? Map.of() : Map.copyOf(previousKeys);
            if (accessTokenTtl == null) {
                accessTokenTtl = TokenSettings.defaults().accessTokenTtl();
            }
        }
    }

    /**
     * @param maxConcurrent sessions per user, 0 for unlimited
     */
    public record Session(Duration ttl, Duration rememberMeTtl, @Min(0) int maxConcurrent) {

        public Session {
            if (ttl == null) {
                ttl = SessionSettings.defaults().ttl();
            }
            if (rememberMeTtl == null) {
                rememberMeTtl = SessionSettings.defaults().rememberMeTtl();
            }
        }
    }

    public record Password(
            @Min(PasswordHasher.MIN_COST) @Max(PasswordHasher.MAX_COST) int bcryptCost,
            Duration hashTimeout) {

        public Password {
            if (bcryptCost == 0) {
                bcryptCost = PasswordHasher.DEFAULT_COST;
            }
            if (hashTimeout == null) {
                hashTimeout = AuthSettings.defaults().hashTimeout();
            }
        }
    }

    public record Mfa(String issuer) {

        public Mfa {
            if (issuer == null || issuer.isBlank()) {
                issuer = "Warden";
            }
        }
    }

    /**
     * @param queueCapacity pending audit writes before new events are dropped
     * @param capacityPerTenant events kept per tenant by the in-memory store
     */
    public record Audit(@Min(0) int queueCapacity, @Min(0) int capacityPerTenant) {

        public Audit {
            if (queueCapacity == 0) {
                queueCapacity = 10_000;
            }
            if (capacityPerTenant == 0) {
                capacityPerTenant = 10_000;
            }
        }
    }

    public record TenantSeed(
            @NotNull UUID id,
            String name,
            @NotBlank String slug,
            String adminEmail,
            TenantStatus status,
            @Min(0) int maxUsers,
            @Min(0) int maxSessionsPerUser) {

        public TenantSeed {
            if (status == null) {
                status = TenantStatus.ACTIVE;
            }
            if (name == null || name.isBlank()) {
                name = slug;
            }
        }

        public Tenant toTenant() {
            return new Tenant(id, name, slug, adminEmail, status, new TenantQuotas(maxUsers, maxSessionsPerUser));
        }
    }

    public TokenSettings tokenSettings() {
        return new TokenSettings(jwt.issuer(), jwt.accessTokenTtl());
    }

    public SessionSettings sessionSettings() {
        return new SessionSettings(session.ttl(), session.rememberMeTtl(), session.maxConcurrent());
    }

    public AuthSettings authSettings() {
        return new AuthSettings(password.hashTimeout(), resetTokenTtl, verificationTokenTtl);
    }

    /**
     * @throws IllegalArgumentException if a secret is shorter than 32 bytes
     */
    public StaticSigningKeyStore signingKeys() {
        List<SigningKey> previous = jwt.previousKeys().entrySet().stream()
                .map(e -> SigningKey.of(e.getKey(), e.getValue()))
                .toList();
        return new StaticSigningKeyStore(SigningKey.of(jwt.keyId(), jwt.secret()), previous);
    }
}
