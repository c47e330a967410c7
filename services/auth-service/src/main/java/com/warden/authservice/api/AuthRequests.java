package com.warden.authservice.api;

import com.warden.security.Role;
import com.warden.security.mfa.MfaMethod;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.util.List;

/**
 * Request bodies of {@link AuthController}. Field names are camelCase JSON properties.
 */
public final class AuthRequests {

    private AuthRequests() {
        // holder
    }

    public record Login(
            @NotBlank @Email String email,
            @NotBlank String password,
            @Pattern(regexp = "[0-9A-Za-z]{6,8}", message = "must be a 6-digit or backup code") String mfaCode,
            boolean rememberMe) {

        @Override
        public String toString() {
            return "Login[email=" + email + "]";
        }
    }

    public record Register(
            @NotBlank @Email String email,
            @NotBlank String password,
            @NotBlank @Size(max = 50) String firstName,
            @NotBlank @Size(max = 50) String lastName) {

        @Override
        public String toString() {
            return "Register[email=" + email + "]";
        }
    }

    public record Refresh(@NotBlank String refreshToken) {
    }

    public record MfaSetup(@NotNull MfaMethod method, String phoneNumber) {
    }

    public record MfaVerify(@NotBlank String code, @NotNull MfaMethod method) {
    }

    public record ForgotPassword(@NotBlank @Email String email) {
    }

    public record ResetPassword(@NotBlank String token, @NotBlank String newPassword) {
    }

    public record VerifyEmail(@NotBlank String token) {
    }

    public record ChangePassword(@NotBlank String currentPassword, @NotBlank String newPassword) {
    }

    /**
     * @param password initial password; when absent the user is invited and must verify the email
     *                 and then reset the password
     */
    public record CreateUser(
            @NotBlank @Email String email,
            @NotBlank @Size(max = 50) String firstName,
            @NotBlank @Size(max = 50) String lastName,
            Role role,
            String password,
            List<String> permissions,
            boolean sendInvitation) {
    }
}
