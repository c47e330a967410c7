package com.warden.security;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Closed vocabulary of permissions that can be granted to a user.
 * <p>
 * The {@code bit} index is part of the token format (see {@code PermissionCodec}): it must
 * never be reused or renumbered once released. New permissions take the next free index.
 */
public enum Permission {

    PROJECTS_READ("projects:read", 0),
    PROJECTS_WRITE("projects:write", 1),
    PROJECTS_DELETE("projects:delete", 2),
    USERS_READ("users:read", 3),
    USERS_MANAGE("users:manage", 4),
    TENANT_MANAGE("tenant:manage", 5),
    BILLING_READ("billing:read", 6),
    BILLING_MANAGE("billing:manage", 7),
    API_KEYS_MANAGE("api_keys:manage", 8),
    AUDIT_READ("audit:read", 9),
    SESSIONS_MANAGE("sessions:manage", 10),
    MFA_MANAGE("mfa:manage", 11);

    private final String code;
    private final int bit;

    Permission(String code, int bit) {
        this.code = code;
        this.bit = bit;
    }

    public String code() {
        return code;
    }

    public int bit() {
        return bit;
    }

    public static Optional<Permission> fromCode(String code) {
        return Arrays.stream(values())
                .filter(p -> p.code.equals(code))
                .findFirst();
    }

    public static Optional<Permission> fromBit(int bit) {
        return Arrays.stream(values())
                .filter(p -> p.bit == bit)
                .findFirst();
    }

    /**
     * Parses permission codes against the vocabulary.
     *
     * @throws IllegalArgumentException naming the first unknown code
     */
    public static Set<Permission> parseAll(Collection<String> codes) {
        Set<Permission> result = EnumSet.noneOf(Permission.class);
        if (codes == null) {
            return result;
        }
        for (String code : codes) {
            result.add(fromCode(code).orElseThrow(
                    () -> new IllegalArgumentException("Unknown permission: " + code)));
        }
        return result;
    }
}
