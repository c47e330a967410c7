package com.warden.security.password;

import java.util.List;

/**
 * Outcome of checking a password against a {@link PasswordPolicy}.
 *
 * @param valid  true when no rule was violated
 * @param errors every violated rule, in policy order (empty when valid)
 */
public record PolicyValidationResult(boolean valid, List<String> errors) {

    public static PolicyValidationResult ok() {
        return new PolicyValidationResult(true, List.of());
    }

    public static PolicyValidationResult fail(List<String> errors) {
        return new PolicyValidationResult(false, List.copyOf(errors));
    }

    /**
     * @throws PasswordPolicyViolationException when invalid
     */
    public void orThrow() {
        if (!valid) {
            throw new PasswordPolicyViolationException(errors);
        }
    }
}
