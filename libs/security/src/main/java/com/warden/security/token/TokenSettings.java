package com.warden.security.token;

import java.time.Duration;

/**
 * @param issuer         value of the {@code iss} claim, required on verification
 * @param accessTokenTtl lifetime of access tokens; refresh tokens live as long as their session
 */
public record TokenSettings(String issuer, Duration accessTokenTtl) {

    public TokenSettings {
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalArgumentException("issuer must not be blank");
        }
        if (accessTokenTtl == null || accessTokenTtl.isZero() || accessTokenTtl.isNegative()) {
            throw new IllegalArgumentException("accessTokenTtl must be positive");
        }
    }

    public static TokenSettings defaults() {
        return new TokenSettings("warden", Duration.ofHours(1));
    }
}
