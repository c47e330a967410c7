package com.warden.security;

/**
 * Role and permission checks for an {@link AuthenticatedPrincipal}, honouring the role hierarchy.
 */
public final class RoleChecker {

    private RoleChecker() {
        // utility class
    }

    public static boolean hasRole(AuthenticatedPrincipal principal, Role required) {
        return principal.role().implies(required);
    }

    public static boolean hasPermission(AuthenticatedPrincipal principal, Permission required) {
        return principal.permissions().contains(required);
    }

    /**
     * @throws InsufficientPermissionsException if the principal's role ranks below {@code required}
     */
    public static void requireRole(AuthenticatedPrincipal principal, Role required) {
        if (!hasRole(principal, required)) {
            throw new InsufficientPermissionsException("Role " + required.value() + " required");
        }
    }

    /**
     * @throws InsufficientPermissionsException if the permission is missing
     */
    public static void requirePermission(AuthenticatedPrincipal principal, Permission required) {
        if (!hasPermission(principal, required)) {
            throw new InsufficientPermissionsException("Permission " + required.code() + " required");
        }
    }
}
