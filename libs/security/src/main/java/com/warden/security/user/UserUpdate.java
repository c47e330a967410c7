package com.warden.security.user;

import com.warden.security.Role;

import java.util.ArrayList;
import java.util.List;

/**
 * Partial update of a user; null fields are left unchanged.
 */
public record UserUpdate(
        String firstName,
        String lastName,
        String displayName,
        Role role,
        UserStatus status,
        List<String> permissions,
        Boolean requirePasswordChange
) {

    public List<String> changedFields() {
        List<String> fields = new ArrayList<>();
        if (firstName != null) {
            fields.add("first_name");
        }
        if (lastName != null) {
            fields.add("last_name");
        }
        if (displayName != null) {
            fields.add("display_name");
        }
        if (role != null) {
            fields.add("role");
        }
        if (status != null) {
            fields.add("status");
        }
        if (permissions != null) {
            fields.add("permissions");
        }
        if (requirePasswordChange != null) {
            fields.add("require_password_change");
        }
        return fields;
    }
}
