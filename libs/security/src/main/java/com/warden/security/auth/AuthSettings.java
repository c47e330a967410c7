package com.warden.security.auth;

import java.time.Duration;

/**
 * @param hashTimeout          upper bound for a single bcrypt hash or verification
 * @param resetTokenTtl        lifetime of password reset tokens
 * @param verificationTokenTtl lifetime of email verification tokens
 */
public record AuthSettings(Duration hashTimeout, Duration resetTokenTtl, Duration verificationTokenTtl) {

    public AuthSettings {
        requirePositive("hashTimeout", hashTimeout);
        requirePositive("resetTokenTtl", resetTokenTtl);
        requirePositive("verificationTokenTtl", verificationTokenTtl);
    }

    /**
     * Two second hash bound, one hour reset tokens, 24 hour verification tokens.
     */
    public static AuthSettings defaults() {
        return new AuthSettings(Duration.ofSeconds(2), Duration.ofHours(1), Duration.ofHours(24));
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
