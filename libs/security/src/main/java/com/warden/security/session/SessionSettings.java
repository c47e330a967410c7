package com.warden.security.session;

import java.time.Duration;

/**
 * @param ttl           lifetime of a regular session
 * @param rememberMeTtl lifetime when the user asked to be remembered
 * @param maxConcurrent active sessions allowed per user, 0 for no limit
 */
public record SessionSettings(Duration ttl, Duration rememberMeTtl, int maxConcurrent) {

    public SessionSettings {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (rememberMeTtl == null || rememberMeTtl.isNegative() || rememberMeTtl.isZero()) {
            throw new IllegalArgumentException("rememberMeTtl must be positive");
        }
        if (maxConcurrent < 0) {
            throw new IllegalArgumentException("maxConcurrent must not be negative");
        }
    }

    /**
     * One day, thirty days with remember-me, no concurrency limit.
     */
    public static SessionSettings defaults() {
        return new SessionSettings(Duration.ofDays(1), Duration.ofDays(30), 0);
    }
}
