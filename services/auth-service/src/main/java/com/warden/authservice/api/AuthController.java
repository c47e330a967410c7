package com.warden.authservice.api;

import com.warden.authservice.infrastructure.web.ResolvedTenant;
import com.warden.security.AuthenticatedPrincipal;
import com.warden.security.BearerTokenExtractor;
import com.warden.security.InsufficientPermissionsException;
import com.warden.security.Permission;
import com.warden.security.ResourceNotFoundException;
import com.warden.security.Role;
import com.warden.security.RoleChecker;
import com.warden.security.audit.AuditEvent;
import com.warden.security.auth.AuthResponse;
import com.warden.security.auth.AuthenticationService;
import com.warden.security.auth.LoginRequest;
import com.warden.security.mfa.MfaSetupResult;
import com.warden.security.session.RequestContext;
import com.warden.security.session.Session;
import com.warden.security.token.TokenPair;
import com.warden.security.user.User;
import com.warden.security.user.UserCreate;
import com.warden.security.user.UserProfile;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP surface of the authentication core.
 *
 * <p>Every endpoint takes the tenant from {@code X-Tenant-ID}. Parameters of type {@link
 * AuthenticatedPrincipal} require a bearer access token of that tenant. Credential failures of any
 * kind come back as the same 401.
 *
 * <p>Constraints on query parameters are checked by MVC method validation, which needs the class
 * to stay free of {@code @Validated}; violations come back as 400.
 */
@RestController
@RequestMapping("/auth")
public class AuthController {

    private final AuthenticationService auth;

    public AuthController(AuthenticationService auth) {
        this.auth = auth;
    }

    @PostMapping("/login")
    public AuthResponse login(@ResolvedTenant UUID tenantId, @Valid @RequestBody AuthRequests.Login body,
                              HttpServletRequest request) {
        LoginRequest login = new LoginRequest(body.email(), body.password(), body.mfaCode(), body.rememberMe(),
                requestContext(request));
        return auth.authenticate(login, tenantId);
    }

    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    public UserProfile register(@ResolvedTenant UUID tenantId, @Valid @RequestBody AuthRequests.Register body) {
        User user = auth.register(new UserCreate(tenantId, body.email(), body.firstName(), body.lastName(),
                null, body.password(), List.of(), true));
        return UserProfile.from(user);
    }

    @PostMapping("/refresh")
    public TokenPair refresh(@ResolvedTenant UUID tenantId, @Valid @RequestBody AuthRequests.Refresh body) {
        return auth.refreshToken(body.refreshToken(), tenantId);
    }

    @PostMapping("/logout")
    public Map<String, Object> logout(@ResolvedTenant UUID tenantId,
                                      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false)
                                      String authorization) {
        BearerTokenExtractor.extract(authorization).ifPresent(auth::logout);
        return Map.of("success", true);
    }

    @GetMapping("/me")
    public UserProfile me(AuthenticatedPrincipal principal) {
        return UserProfile.from(auth.getUser(principal.userId(), principal.tenantId()));
    }

    @PostMapping("/mfa/setup")
    public MfaSetupResult setupMfa(AuthenticatedPrincipal principal, @Valid @RequestBody AuthRequests.MfaSetup body) {
        return auth.setupMfa(principal.userId(), principal.tenantId(), body.method(), body.phoneNumber());
    }

    @PostMapping("/mfa/verify")
    public Map<String, Object> verifyMfa(AuthenticatedPrincipal principal,
                                         @Valid @RequestBody AuthRequests.MfaVerify body) {
        if (!auth.verifyMfa(principal.userId(), principal.tenantId(), body.code(), body.method())) {
            throw new IllegalArgumentException("Invalid MFA code");
        }
        return Map.of("mfaEnabled", true, "method", body.method());
    }

    @PostMapping("/forgot-password")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, Object> forgotPassword(@ResolvedTenant UUID tenantId,
                                              @Valid @RequestBody AuthRequests.ForgotPassword body) {
        auth.requestPasswordReset(body.email(), tenantId);
        return Map.of("message", "If the account exists, a reset link has been sent");
    }

    @PostMapping("/reset-password")
    public Map<String, Object> resetPassword(@ResolvedTenant UUID tenantId,
                                             @Valid @RequestBody AuthRequests.ResetPassword body) {
        if (!auth.resetPassword(body.token(), body.newPassword(), tenantId)) {
            throw new IllegalArgumentException("Invalid or expired reset token");
        }
        return Map.of("success", true);
    }

    @PostMapping("/verify-email")
    public Map<String, Object> verifyEmail(@ResolvedTenant UUID tenantId,
                                           @Valid @RequestBody AuthRequests.VerifyEmail body) {
        if (!auth.verifyEmail(body.token(), tenantId)) {
            throw new IllegalArgumentException("Invalid or expired verification token");
        }
        return Map.of("success", true);
    }

    @PutMapping("/users/me/password")
    public Map<String, Object> changePassword(AuthenticatedPrincipal principal,
                                              @Valid @RequestBody AuthRequests.ChangePassword body) {
        if (!auth.changePassword(principal.userId(), body.currentPassword(), body.newPassword(),
                principal.tenantId())) {
            throw new IllegalArgumentException("Current password is incorrect");
        }
        return Map.of("success", true);
    }

    @GetMapping("/sessions")
    public List<Session> sessions(AuthenticatedPrincipal principal) {
        return auth.listSessions(principal.userId(), principal.tenantId());
    }

    @DeleteMapping("/sessions/{sessionId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void revokeSession(AuthenticatedPrincipal principal, @PathVariable UUID sessionId) {
        if (!auth.revokeOwnSession(sessionId, principal.userId(), principal.tenantId())) {
            throw new ResourceNotFoundException("Session", sessionId);
        }
    }

    @PostMapping("/users")
    @ResponseStatus(HttpStatus.CREATED)
    public UserProfile createUser(AuthenticatedPrincipal principal, @Valid @RequestBody AuthRequests.CreateUser body) {
        RoleChecker.requirePermission(principal, Permission.USERS_MANAGE);
        if (body.role() != null && !RoleChecker.hasRole(principal, body.role())) {
            throw new InsufficientPermissionsException("Cannot grant role " + body.role().value());
        }
        User user = auth.createUser(new UserCreate(principal.tenantId(), body.email(), body.firstName(),
                body.lastName(), body.role(), body.password(), body.permissions(), body.sendInvitation()),
                principal.userId());
        return UserProfile.from(user);
    }

    @GetMapping("/users")
    public List<UserProfile> listUsers(AuthenticatedPrincipal principal) {
        RoleChecker.requireRole(principal, Role.ADMIN);
        return auth.listUsers(principal.tenantId()).stream().map(UserProfile::from).toList();
    }

    @GetMapping("/audit")
    public List<AuditEvent> audit(AuthenticatedPrincipal principal,
                                  @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit) {
        RoleChecker.requirePermission(principal, Permission.AUDIT_READ);
        return auth.auditTrail(principal.tenantId(), limit);
    }

    private static RequestContext requestContext(HttpServletRequest request) {
        return new RequestContext(request.getRemoteAddr(), request.getHeader(HttpHeaders.USER_AGENT));
    }
}
