package com.warden.security.token;

import com.warden.security.AuthenticatedPrincipal;
import com.warden.security.Permission;
import com.warden.security.Role;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * Verified content of a token.
 *
 * @param email null for refresh tokens
 */
public record TokenClaims(
        UUID userId,
        UUID tenantId,
        UUID sessionId,
        Role role,
        Set<Permission> permissions,
        String email,
        TokenType type,
        String tokenId,
        Instant issuedAt,
        Instant expiresAt
) {

    public TokenClaims {
        permissions = Set.copyOf(permissions);
    }

    public AuthenticatedPrincipal toPrincipal() {
        return new AuthenticatedPrincipal(userId, tenantId, sessionId, email, role, permissions);
    }
}
