package com.warden.security.user;

import com.warden.security.Permission;
import com.warden.security.Role;
import com.warden.security.mfa.MfaMethod;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * Read-only view of a user without credentials or MFA secrets.
 */
public record UserProfile(
        UUID id,
        UUID tenantId,
        String email,
        String firstName,
        String lastName,
        String displayName,
        Role role,
        UserStatus status,
        Set<Permission> permissions,
        boolean mfaEnabled,
        Set<MfaMethod> mfaMethods,
        boolean emailVerified,
        Instant lastLoginAt,
        Instant createdAt
) {

    public UserProfile {
        permissions = Set.copyOf(permissions);
        mfaMethods = Set.copyOf(mfaMethods);
    }

    public static UserProfile from(User user) {
        return new UserProfile(
                user.getId(),
                user.getTenantId(),
                user.getEmail(),
                user.getFirstName(),
                user.getLastName(),
                user.fullName(),
                user.getRole(),
                user.getStatus(),
                user.effectivePermissions(),
                user.isMfaEnabled(),
                user.getMfaMethods(),
                user.isEmailVerified(),
                user.getLastLoginAt(),
                user.getCreatedAt());
    }
}
