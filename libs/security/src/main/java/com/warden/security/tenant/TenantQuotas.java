package com.warden.security.tenant;

/**
 * Per-tenant limits relevant to authentication.
 *
 * @param maxUsers           maximum number of users (0 = unlimited)
 * @param maxSessionsPerUser maximum concurrent sessions per user (0 = service default)
 */
public record TenantQuotas(int maxUsers, int maxSessionsPerUser) {

    public TenantQuotas {
        if (maxUsers < 0 || maxSessionsPerUser < 0) {
            throw new IllegalArgumentException("quotas must not be negative");
        }
    }

    public static TenantQuotas unlimited() {
        return new TenantQuotas(0, 0);
    }
}
