package com.warden.security.user;

import com.warden.security.Role;

import java.util.List;
import java.util.UUID;

/**
 * Input for creating a user.
 *
 * @param tenantId        target tenant
 * @param email           email, unique within the tenant
 * @param firstName       first name (1..50 chars)
 * @param lastName        last name (1..50 chars)
 * @param role            role, DEVELOPER when null
 * @param password        initial password; null creates an account that must go through reset
 * @param permissions     extra permission codes on top of the role defaults
 * @param sendInvitation  when true the account starts PENDING_ACTIVATION and must verify its email
 */
public record UserCreate(
        UUID tenantId,
        String email,
        String firstName,
        String lastName,
        Role role,
        String password,
        List<String> permissions,
        boolean sendInvitation
) {

    public UserCreate {
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
        if (role == null) {
            role = Role.DEVELOPER;
        }
    }

    /**
     * Active account with a password and default role, the common case in tests and seeding.
     */
    public static UserCreate active(UUID tenantId, String email, String password, Role role) {
        return new UserCreate(tenantId, email, "Test", "User", role, password, List.of(), false);
    }

    /**
     * @throws IllegalArgumentException listing the first invalid field
     */
    public void validate() {
        if (tenantId == null) {
            throw new IllegalArgumentException("tenantId is required");
        }
        if (email == null || email.isBlank() || !email.contains("@")) {
            throw new IllegalArgumentException("A valid email is required");
        }
        requireName("firstName", firstName);
        requireName("lastName", lastName);
    }

    private static void requireName(String field, String value) {
        if (value == null || value.isBlank() || value.length() > 50) {
            throw new IllegalArgumentException(field + " must be 1 to 50 characters");
        }
    }
}
