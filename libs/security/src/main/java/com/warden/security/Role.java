package com.warden.security;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Roles a user can hold inside a tenant, ordered from most to least privileged.
 * <p>
 * A role implies every role with a lower rank: OWNER implies ADMIN, ADMIN implies MANAGER,
 * and so on down to GUEST. Each role also carries the permissions granted by default; a user's
 * effective permissions are the role defaults plus any permissions assigned individually.
 */
public enum Role {

    OWNER("owner", 60, EnumSet.allOf(Permission.class)),
    ADMIN("admin", 50, EnumSet.of(
            Permission.PROJECTS_READ, Permission.PROJECTS_WRITE, Permission.PROJECTS_DELETE,
            Permission.USERS_READ, Permission.USERS_MANAGE, Permission.BILLING_READ,
            Permission.API_KEYS_MANAGE, Permission.AUDIT_READ, Permission.SESSIONS_MANAGE,
            Permission.MFA_MANAGE)),
    MANAGER("manager", 40, EnumSet.of(
            Permission.PROJECTS_READ, Permission.PROJECTS_WRITE, Permission.USERS_READ,
            Permission.BILLING_READ)),
    DEVELOPER("developer", 30, EnumSet.of(
            Permission.PROJECTS_READ, Permission.PROJECTS_WRITE, Permission.API_KEYS_MANAGE)),
    VIEWER("viewer", 20, EnumSet.of(Permission.PROJECTS_READ)),
    GUEST("guest", 10, EnumSet.noneOf(Permission.class));

    private final String value;
    private final int rank;
    private final Set<Permission> defaultPermissions;

    Role(String value, int rank, Set<Permission> defaultPermissions) {
        this.value = value;
        this.rank = rank;
        this.defaultPermissions = Collections.unmodifiableSet(defaultPermissions);
    }

    /** Canonical lower-case name, as carried in tokens. */
    public String value() {
        return value;
    }

    public Set<Permission> defaultPermissions() {
        return defaultPermissions;
    }

    /**
     * True when this role is the given role or ranks above it.
     */
    public boolean implies(Role other) {
        return this.rank >= other.rank;
    }

    public static Optional<Role> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(role -> role.value.equals(normalized))
                .findFirst();
    }
}
