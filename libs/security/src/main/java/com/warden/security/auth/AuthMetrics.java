package com.warden.security.auth;

import com.warden.observability.MetricFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

/**
 * Authentication counters and the password hashing timer.
 */
public class AuthMetrics {

    public static final String LOGIN = "warden.auth.login";
    public static final String LOCKOUTS = "warden.auth.lockouts";
    public static final String TOKEN_REFRESH = "warden.auth.token.refresh";
    public static final String PASSWORD_HASH = "warden.auth.password.hash";

    private final MetricFactory metrics;

    public AuthMetrics(MetricFactory metrics) {
        this.metrics = metrics;
    }

    /**
     * Metrics recorded into a private registry nobody reads.
     */
    public static AuthMetrics detached() {
        return new AuthMetrics(new MetricFactory(new SimpleMeterRegistry(), "warden"));
    }

    public void loginSucceeded() {
        metrics.counter(LOGIN, "Login attempts", "outcome", "success").increment();
    }

    public void loginFailed(String reason) {
        metrics.counter(LOGIN, "Login attempts", "outcome", "failure", "reason", reason).increment();
    }

    public void mfaChallenged() {
        metrics.counter(LOGIN, "Login attempts", "outcome", "mfa_required").increment();
    }

    public void accountLocked() {
        metrics.counter(LOCKOUTS, "Accounts locked after repeated failures").increment();
    }

    public void tokenRefreshed(boolean success) {
        metrics.counter(TOKEN_REFRESH, "Token refreshes", "outcome", success ? "success" : "failure").increment();
    }

    public <T> T timePasswordHash(Supplier<T> hashing) {
        return metrics.timer(PASSWORD_HASH, "bcrypt hash and verify duration").record(hashing);
    }
}
