package com.warden.security;

import java.util.Set;
import java.util.UUID;

/**
 * The caller behind a verified access token.
 *
 * @param userId      authenticated user
 * @param tenantId    tenant the token was issued for; every lookup made on behalf of this
 *                    principal is scoped to it
 * @param sessionId   session the token is bound to
 * @param email       user's email at issuance time
 * @param role        user's role at issuance time
 * @param permissions effective permissions at issuance time
 */
public record AuthenticatedPrincipal(
        UUID userId,
        UUID tenantId,
        UUID sessionId,
        String email,
        Role role,
        Set<Permission> permissions
) {

    public AuthenticatedPrincipal {
        permissions = Set.copyOf(permissions);
    }
}
