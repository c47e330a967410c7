package com.warden.security.password;

import java.util.List;

/**
 * A new password does not satisfy the tenant's policy. Carries every violated rule.
 */
public class PasswordPolicyViolationException extends RuntimeException {

    private final List<String> violations;

    public PasswordPolicyViolationException(List<String> violations) {
        super("Password does not meet policy: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> violations() {
        return violations;
    }
}
