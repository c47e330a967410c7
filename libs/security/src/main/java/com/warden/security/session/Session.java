package com.warden.security.session;

import java.time.Instant;
import java.util.UUID;

/**
 * Server-side record of one signed-in device. Immutable; state changes produce a new instance.
 * <p>
 * {@code ACTIVE} moves to {@code EXPIRED} or {@code REVOKED}; both are final.
 */
public record Session(
        UUID id,
        UUID userId,
        UUID tenantId,
        SessionStatus status,
        String ipAddress,
        String userAgent,
        String authMethod,
        boolean mfaVerified,
        boolean rememberMe,
        Instant createdAt,
        Instant lastActivityAt,
        Instant expiresAt
) {

    public static final String AUTH_METHOD_LOCAL = "local";

    public Session {
        if (id == null || userId == null || tenantId == null) {
            throw new IllegalArgumentException("id, userId and tenantId must not be null");
        }
        if (status == null || createdAt == null || expiresAt == null) {
            throw new IllegalArgumentException("status, createdAt and expiresAt must not be null");
        }
        if (lastActivityAt == null) {
            lastActivityAt = createdAt;
        }
    }

    public boolean isActiveAt(Instant now) {
        return status == SessionStatus.ACTIVE && expiresAt.isAfter(now);
    }

    Session withStatus(SessionStatus newStatus) {
        if (status.isTerminal()) {
            return this;
        }
        return new Session(id, userId, tenantId, newStatus, ipAddress, userAgent, authMethod,
                mfaVerified, rememberMe, createdAt, lastActivityAt, expiresAt);
    }

    Session withLastActivityAt(Instant at) {
        return new Session(id, userId, tenantId, status, ipAddress, userAgent, authMethod,
                mfaVerified, rememberMe, createdAt, at, expiresAt);
    }
}
