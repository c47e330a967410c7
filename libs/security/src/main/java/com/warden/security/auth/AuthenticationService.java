package com.warden.security.auth;

import com.warden.observability.SensitiveDataRedactor;
import com.warden.security.AuthenticatedPrincipal;
import com.warden.security.InvalidCredentialsException;
import com.warden.security.Permission;
import com.warden.security.ResourceNotFoundException;
import com.warden.security.Role;
import com.warden.security.SecureTokens;
import com.warden.security.TokenExpiredException;
import com.warden.security.audit.AuditDetails;
import com.warden.security.audit.AuditEvent;
import com.warden.security.audit.AuditEventType;
import com.warden.security.audit.AuditLogger;
import com.warden.security.mfa.MfaMethod;
import com.warden.security.mfa.MfaService;
import com.warden.security.mfa.MfaSetupResult;
import com.warden.security.notify.NotificationChannel;
import com.warden.security.notify.NotificationSender;
import com.warden.security.password.PasswordHasher;
import com.warden.security.password.PasswordPolicy;
import com.warden.security.password.PasswordPolicyEngine;
import com.warden.security.password.PasswordPolicyViolationException;
import com.warden.security.password.PersonalInfo;
import com.warden.security.session.RequestContext;
import com.warden.security.session.Session;
import com.warden.security.session.SessionManager;
import com.warden.security.tenant.Tenant;
import com.warden.security.tenant.TenantDirectory;
import com.warden.security.token.TokenClaims;
import com.warden.security.token.TokenPair;
import com.warden.security.token.TokenService;
import com.warden.security.user.FailedLoginOutcome;
import com.warden.security.user.User;
import com.warden.security.user.UserCreate;
import com.warden.security.user.UserProfile;
import com.warden.security.user.UserRepository;
import com.warden.security.user.UserStatus;
import com.warden.security.user.UserUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point for every authentication use case: accounts, login, tokens, password recovery,
 * email verification, MFA enrollment and sessions.
 * <p>
 * Every lookup takes the tenant id supplied by the caller and never crosses tenants. Login
 * failures of any kind (unknown email, wrong password, wrong tenant, locked or inactive account,
 * wrong MFA code) surface as the same {@link InvalidCredentialsException}, and an unknown email
 * still costs one bcrypt verification.
 * <p>
 * {@link #changePassword} and {@link #resetPassword} report a wrong current password, an
 * unknown user or an invalid token as {@code false} rather than as an exception. A new password
 * that fails the tenant's policy is rejected with {@link PasswordPolicyViolationException}.
 * <p>
 * Safe for concurrent use; all shared state lives in the repositories.
 */
public class AuthenticationService {

    private static final Logger log = LoggerFactory.getLogger(AuthenticationService.class);

    private final UserRepository users;
    private final TenantDirectory tenants;
    private final SessionManager sessions;
    private final TokenService tokens;
    private final PasswordHasher hasher;
    private final PasswordPolicyEngine policies;
    private final MfaService mfa;
    private final AuditLogger audit;
    private final NotificationSender notifications;
    private final AuthMetrics metrics;
    private final AuthSettings settings;
    private final Clock clock;

    public AuthenticationService(UserRepository users,
                                 TenantDirectory tenants,
                                 SessionManager sessions,
                                 TokenService tokens,
                                 PasswordHasher hasher,
                                 PasswordPolicyEngine policies,
                                 MfaService mfa,
                                 AuditLogger audit,
                                 NotificationSender notifications,
                                 AuthMetrics metrics,
                                 AuthSettings settings,
                                 Clock clock) {
        this.users = users;
        this.tenants = tenants;
        this.sessions = sessions;
        this.tokens = tokens;
        this.hasher = hasher;
        this.policies = policies;
        this.mfa = mfa;
        this.audit = audit;
        this.notifications = notifications;
        this.metrics = metrics;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Creates an account on behalf of an administrator.
     *
     * @param createdBy acting user, null for system seeding
     * @throws IllegalArgumentException             for invalid input or unknown permission codes
     * @throws PasswordPolicyViolationException     when the initial password fails the policy
     * @throws com.warden.security.user.DuplicateUserException when the email is taken in the tenant
     */
    public User createUser(UserCreate create, UUID createdBy) {
        create.validate();
        User user = newUser(create, create.role(), Permission.parseAll(create.permissions()));
        user.setStatus(create.sendInvitation() ? UserStatus.PENDING_ACTIVATION : UserStatus.ACTIVE);
        User stored = users.insert(user);

        log.info("User {} created in tenant {}", stored.getId(), stored.getTenantId());
        audit.log(stored.getTenantId(), AuditEventType.USER_CREATED, "User account created", true,
                AuditDetails.of(stored).with("created_by", createdBy).with("role", stored.getRole().value()));
        if (create.sendInvitation()) {
            sendVerification(stored, generateEmailVerificationToken(stored.getId(), stored.getTenantId()));
        }
        return stored;
    }

    /**
     * Self-service sign-up. The account gets the default role, no extra permissions, and stays
     * {@link UserStatus#PENDING_ACTIVATION} until its email is verified.
     */
    public User register(UserCreate create) {
        create.validate();
        if (create.password() == null || create.password().isEmpty()) {
            throw new IllegalArgumentException("Password is required");
        }
        User user = newUser(create, Role.DEVELOPER, Set.of());
        user.setStatus(UserStatus.PENDING_ACTIVATION);
        User stored = users.insert(user);

        log.info("User {} registered in tenant {}", stored.getId(), stored.getTenantId());
        audit.log(stored.getTenantId(), AuditEventType.USER_REGISTERED, "User registered", true, AuditDetails.of(stored));
        sendVerification(stored, generateEmailVerificationToken(stored.getId(), stored.getTenantId()));
        return stored;
    }

    /**
     * @throws ResourceNotFoundException when the user does not exist in the tenant
     */
    public User getUser(UUID userId, UUID tenantId) {
        return users.findById(userId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("User", userId));
    }

    public Optional<User> findUserByEmail(String email, UUID tenantId) {
        return users.findByEmail(email, tenantId);
    }

    public List<User> listUsers(UUID tenantId) {
        return users.findAllByTenant(tenantId);
    }

    /**
     * Applies the non-null fields of {@code update}. Moving a user out of ACTIVE revokes all of
     * their sessions.
     */
    public User updateUser(UUID userId, UserUpdate update, UUID tenantId) {
        Set<Permission> permissions = update.permissions() != null ? Permission.parseAll(update.permissions()) : null;
        Instant now = clock.instant();
        User stored = users.update(userId, tenantId, user -> {
            if (update.firstName() != null) {
                user.setFirstName(update.firstName());
            }
            if (update.lastName() != null) {
                user.setLastName(update.lastName());
            }
            if (update.displayName() != null) {
                user.setDisplayName(update.displayName());
            }
            if (update.role() != null) {
                user.setRole(update.role());
            }
            if (update.status() != null) {
                user.setStatus(update.status());
            }
            if (permissions != null) {
                user.setPermissions(permissions);
            }
            if (update.requirePasswordChange() != null) {
                user.setRequirePasswordChange(update.requirePasswordChange());
            }
            user.setUpdatedAt(now);
        });

        if (stored.getStatus() != UserStatus.ACTIVE) {
            sessions.revokeAll(userId, tenantId);
        }
        audit.log(tenantId, AuditEventType.USER_UPDATED, "User updated", true,
                AuditDetails.of(stored).with("fields", update.changedFields()));
        return stored;
    }

    /**
     * Password login, followed by an MFA check when the user enrolled one.
     *
     * @return tokens on success, or an MFA challenge when a code is needed and none was given
     * @throws IllegalArgumentException     when email or password is blank
     * @throws InvalidCredentialsException  for every authentication failure
     */
    public AuthResponse authenticate(LoginRequest request, UUID tenantId) {
        requireText(request.email(), "Email");
        requireText(request.password(), "Password");
        if (tenantId == null) {
            throw new IllegalArgumentException("Tenant is required");
        }
        Instant now = clock.instant();
        RequestContext context = request.context();

        Optional<User> found = users.findByEmail(request.email(), tenantId);
        if (found.isEmpty()) {
            metrics.timePasswordHash(() -> {
                hasher.dummyVerify(request.password());
                return null;
            });
            throw loginFailure(tenantId, null, request.email(), "unknown_user", context);
        }
        User user = found.get();
        if (user.isLocked(now)) {
            metrics.timePasswordHash(() -> {
                hasher.dummyVerify(request.password());
                return null;
            });
            throw loginFailure(tenantId, user, user.getEmail(), "locked", context);
        }
        if (!verifyPassword(request.password(), user.getPasswordHash())) {
            registerFailedAttempt(user, now, context);
            throw loginFailure(tenantId, user, user.getEmail(), "bad_password", context);
        }
        if (user.getStatus() != UserStatus.ACTIVE) {
            throw loginFailure(tenantId, user, user.getEmail(), "inactive", context);
        }

        if (user.isMfaEnabled()) {
            if (request.mfaCode() == null || request.mfaCode().isBlank()) {
                metrics.mfaChallenged();
                log.debug("MFA required for user {}", user.getId());
                return AuthResponse.mfaChallenge(List.copyOf(user.getMfaMethods()));
            }
            if (!verifyLoginMfa(user, request.mfaCode())) {
                registerFailedAttempt(user, now, context);
                audit.log(tenantId, AuditEventType.MFA_FAILED, "MFA verification failed at login", false,
                        AuditDetails.of(user).withRequest(context));
                throw loginFailure(tenantId, user, user.getEmail(), "bad_mfa_code", context);
            }
        }

        Session session = sessions.create(user, context, request.rememberMe(), user.isMfaEnabled(),
                sessionLimit(tenantId));
        TokenPair pair = tokens.issue(user, session);
        users.recordSuccessfulLogin(user.getId(), tenantId, now);
        user.clearLockout();
        user.setLastLoginAt(now);

        boolean changeRequired = user.isRequirePasswordChange()
                || policies.isExpired(user.getPasswordChangedAt(), tenantId, now);
        metrics.loginSucceeded();
        log.info("User {} logged in to tenant {} (session {})", user.getId(), tenantId, session.id());
        audit.log(tenantId, AuditEventType.LOGIN_SUCCESS, "User logged in", true,
                AuditDetails.of(user).withRequest(context).with("session_id", session.id()));
        return AuthResponse.authenticated(pair, UserProfile.from(user), session.id(), changeRequired);
    }

    /**
     * Resolves a bearer access token to its principal. The token's session must still be active.
     *
     * @throws TokenExpiredException       when the token expired
     * @throws InvalidCredentialsException for any other invalid token or a closed session
     */
    public AuthenticatedPrincipal authenticateBearer(String accessToken) {
        TokenClaims claims = tokens.verifyAccess(accessToken);
        sessions.touch(claims.sessionId(), claims.tenantId())
                .orElseThrow(InvalidCredentialsException::new);
        return claims.toPrincipal();
    }

    /**
     * Revokes the session behind the token. Invalid or expired tokens are ignored.
     */
    public void logout(String token) {
        TokenClaims claims;
        try {
            claims = tokens.verify(token);
        } catch (InvalidCredentialsException | TokenExpiredException e) {
            log.debug("Logout with unusable token: {}", e.getMessage());
            return;
        }
        sessions.revoke(claims.sessionId(), claims.tenantId());
        audit.log(claims.tenantId(), AuditEventType.LOGOUT, "User logged out", true,
                AuditDetails.none().withUser(claims.userId(), claims.email()).with("session_id", claims.sessionId()));
    }

    /**
     * @return number of sessions revoked
     */
    public int logoutAll(UUID userId, UUID tenantId) {
        int revoked = sessions.revokeAll(userId, tenantId);
        audit.log(tenantId, AuditEventType.LOGOUT, "All sessions closed", true,
                AuditDetails.none().withUser(userId, null).with("sessions_revoked", revoked));
        return revoked;
    }

    /**
     * Exchanges a refresh token for a new pair in the same tenant. The session must still be
     * active and the user must still be ACTIVE. The new tokens carry the user's current role and
     * permissions.
     */
    public TokenPair refreshToken(String refreshToken) {
        return refreshToken(refreshToken, null);
    }

    /**
     * As {@link #refreshToken(String)}, additionally requiring the token to belong to
     * {@code tenantId}. A null tenant skips that check.
     */
    public TokenPair refreshToken(String refreshToken, UUID tenantId) {
        try {
            TokenClaims claims = tokens.verifyRefresh(refreshToken);
            if (tenantId != null && !tenantId.equals(claims.tenantId())) {
                throw new InvalidCredentialsException();
            }
            Session session = sessions.findActive(claims.sessionId(), claims.tenantId())
                    .orElseThrow(InvalidCredentialsException::new);
            User user = users.findById(claims.userId(), claims.tenantId())
                    .filter(u -> u.getStatus() == UserStatus.ACTIVE)
                    .orElseThrow(InvalidCredentialsException::new);
            TokenPair pair = tokens.refresh(refreshToken, user, session);
            metrics.tokenRefreshed(true);
            audit.log(claims.tenantId(), AuditEventType.TOKEN_REFRESHED, "Tokens refreshed", true,
                    AuditDetails.none().withUser(claims.userId(), null).with("session_id", claims.sessionId()));
            return pair;
        } catch (InvalidCredentialsException | TokenExpiredException e) {
            metrics.tokenRefreshed(false);
            throw e;
        }
    }

    /**
     * @return false when the user does not exist in the tenant or {@code oldPassword} is wrong
     * @throws PasswordPolicyViolationException when the new password fails the policy or was
     *                                          used recently
     */
    public boolean changePassword(UUID userId, String oldPassword, String newPassword, UUID tenantId) {
        Optional<User> found = users.findById(userId, tenantId);
        if (found.isEmpty()) {
            hasher.dummyVerify(oldPassword);
            return false;
        }
        User user = found.get();
        if (!verifyPassword(oldPassword, user.getPasswordHash())) {
            log.debug("Password change rejected for user {}", userId);
            return false;
        }
        PasswordPolicy policy = policies.getPolicy(tenantId);
        String newHash = hashNewPassword(user, newPassword, policy);
        Instant now = clock.instant();
        User stored = users.update(userId, tenantId, u -> {
            u.changePasswordHash(newHash, now, policy.historyCount());
            u.setUpdatedAt(now);
        });

        log.info("Password changed for user {}", userId);
        audit.log(tenantId, AuditEventType.PASSWORD_CHANGED, "Password changed", true, AuditDetails.of(stored));
        return true;
    }

    /**
     * Sends a reset token to the user if the email is known. Completes the same way either way.
     */
    public void requestPasswordReset(String email, UUID tenantId) {
        Optional<User> found = users.findByEmail(email, tenantId);
        if (found.isEmpty()) {
            log.debug("Password reset requested for unknown email {}", SensitiveDataRedactor.maskEmail(email));
            return;
        }
        User user = found.get();
        String token = generatePasswordResetToken(user.getId(), tenantId);
        notifications.send(NotificationChannel.EMAIL, user.getEmail(), "Reset your password",
                "Use this token to reset your password: " + token);
        audit.log(tenantId, AuditEventType.PASSWORD_RESET_REQUESTED, "Password reset requested", true,
                AuditDetails.of(user));
    }

    /**
     * Issues a single-use reset token, replacing any earlier one. Only its hash is stored.
     */
    public String generatePasswordResetToken(UUID userId, UUID tenantId) {
        String token = SecureTokens.urlSafeToken();
        Instant now = clock.instant();
        users.update(userId, tenantId, u -> {
            u.setPasswordResetToken(SecureTokens.sha256(token), now.plus(settings.resetTokenTtl()));
            u.setUpdatedAt(now);
        });
        return token;
    }

    /**
     * Consumes a reset token. Clears the failed-login counter and lock, and closes all sessions.
     *
     * @return false for an unknown, expired or already used token
     * @throws PasswordPolicyViolationException when the new password fails the policy; the token
     *                                          stays usable
     */
    public boolean resetPassword(String token, String newPassword, UUID tenantId) {
        if (token == null || token.isBlank()) {
            return false;
        }
        String tokenHash = SecureTokens.sha256(token);
        Optional<User> found = users.findByPasswordResetTokenHash(tokenHash, tenantId);
        if (found.isEmpty()) {
            return false;
        }
        User holder = found.get();
        Instant now = clock.instant();
        if (holder.getPasswordResetExpires() == null || !holder.getPasswordResetExpires().isAfter(now)) {
            users.consumePasswordResetToken(tokenHash, tenantId, now, u -> { });
            log.debug("Expired reset token presented for user {}", holder.getId());
            return false;
        }
        PasswordPolicy policy = policies.getPolicy(tenantId);
        String newHash = hashNewPassword(holder, newPassword, policy);
        Optional<User> consumed = users.consumePasswordResetToken(tokenHash, tenantId, now, u -> {
            u.changePasswordHash(newHash, now, policy.historyCount());
            u.clearLockout();
            if (u.getStatus() == UserStatus.PENDING_PASSWORD_RESET) {
                u.setStatus(UserStatus.ACTIVE);
            }
            u.setUpdatedAt(now);
        });
        if (consumed.isEmpty()) {
            log.debug("Reset token for user {} was used concurrently", holder.getId());
            return false;
        }
        User user = consumed.get();
        sessions.revokeAll(user.getId(), tenantId);

        log.info("Password reset for user {}", user.getId());
        audit.log(tenantId, AuditEventType.PASSWORD_RESET, "Password reset", true, AuditDetails.of(user));
        return true;
    }

    public String generateEmailVerificationToken(UUID userId, UUID tenantId) {
        String token = SecureTokens.urlSafeToken();
        Instant now = clock.instant();
        users.update(userId, tenantId, u -> {
            u.setEmailVerificationToken(SecureTokens.sha256(token), now.plus(settings.verificationTokenTtl()));
            u.setUpdatedAt(now);
        });
        return token;
    }

    /**
     * Marks the email verified and activates a pending account.
     *
     * @return false for an unknown, expired or already used token
     */
    public boolean verifyEmail(String token, UUID tenantId) {
        if (token == null || token.isBlank()) {
            return false;
        }
        Instant now = clock.instant();
        Optional<User> verified = users.consumeEmailVerificationToken(SecureTokens.sha256(token), tenantId, now, u -> {
            u.setEmailVerified(true);
            if (u.getStatus() == UserStatus.PENDING_ACTIVATION) {
                u.setStatus(UserStatus.ACTIVE);
            }
            u.setUpdatedAt(now);
        });
        if (verified.isEmpty()) {
            return false;
        }
        User user = verified.get();
        audit.log(tenantId, AuditEventType.EMAIL_VERIFIED, "Email verified", true, AuditDetails.of(user));
        return true;
    }

    /**
     * Enrollment runs against a snapshot; only its MFA fields are written back.
     */
    public MfaSetupResult setupMfa(UUID userId, UUID tenantId, MfaMethod method, String phoneNumber) {
        User user = getUser(userId, tenantId);
        MfaSetupResult result = mfa.setup(user, method, phoneNumber);
        saveMfaState(user);
        audit.log(tenantId, AuditEventType.MFA_SETUP, "MFA enrollment started", true,
                AuditDetails.of(user).with("method", method.value()));
        return result;
    }

    /**
     * Confirms an enrollment started by {@link #setupMfa}. On success MFA is enabled.
     */
    public boolean verifyMfa(UUID userId, UUID tenantId, String code, MfaMethod method) {
        User user = getUser(userId, tenantId);
        if (!mfa.confirmSetup(user, code, method)) {
            audit.log(tenantId, AuditEventType.MFA_FAILED, "MFA setup confirmation failed", false,
                    AuditDetails.of(user).with("method", method.value()));
            return false;
        }
        saveMfaState(user);
        log.info("MFA ({}) enabled for user {}", method.value(), userId);
        audit.log(tenantId, AuditEventType.MFA_ENABLED, "MFA enabled", true,
                AuditDetails.of(user).with("method", method.value()));
        return true;
    }

    public void disableMfa(UUID userId, UUID tenantId) {
        Instant now = clock.instant();
        User user = users.update(userId, tenantId, u -> {
            mfa.disable(u);
            u.setUpdatedAt(now);
        });
        audit.log(tenantId, AuditEventType.MFA_DISABLED, "MFA disabled", true, AuditDetails.of(user));
    }

    public List<Session> listSessions(UUID userId, UUID tenantId) {
        return sessions.listActive(userId, tenantId);
    }

    /**
     * @return false when the session does not exist in the tenant
     */
    public boolean revokeSession(UUID sessionId, UUID tenantId) {
        Optional<Session> revoked = sessions.revoke(sessionId, tenantId);
        revoked.ifPresent(s -> audit.log(tenantId, AuditEventType.SESSION_REVOKED, "Session revoked", true,
                AuditDetails.none().withUser(s.userId(), null).with("session_id", sessionId)));
        return revoked.isPresent();
    }

    /**
     * Revokes a session only if it belongs to {@code userId}.
     */
    public boolean revokeOwnSession(UUID sessionId, UUID userId, UUID tenantId) {
        boolean owned = sessions.get(sessionId, tenantId)
                .filter(s -> s.userId().equals(userId))
                .isPresent();
        return owned && revokeSession(sessionId, tenantId);
    }

    public List<AuditEvent> auditTrail(UUID tenantId, int limit) {
        return audit.recent(tenantId, limit);
    }

    private User newUser(UserCreate create, Role role, Set<Permission> permissions) {
        enforceUserQuota(create.tenantId());
        Instant now = clock.instant();
        User user = new User(UUID.randomUUID(), create.tenantId(), create.email());
        user.setFirstName(create.firstName());
        user.setLastName(create.lastName());
        user.setRole(role);
        user.setPermissions(permissions);
        if (create.password() != null) {
            policies.validate(create.password(), create.tenantId(),
                    new PersonalInfo(create.email(), create.firstName(), create.lastName())).orThrow();
            user.setPasswordHash(hash(create.password()));
            user.setPasswordChangedAt(now);
        }
        user.setCreatedAt(now);
        user.setUpdatedAt(now);
        return user;
    }

    /**
     * Checks {@code newPassword} against the policy and the user's recent passwords and hashes it.
     */
    private String hashNewPassword(User user, String newPassword, PasswordPolicy policy) {
        policies.validate(newPassword, policy,
                new PersonalInfo(user.getEmail(), user.getFirstName(), user.getLastName())).orThrow();
        if (policies.isReused(newPassword, user.getPasswordHash(), user.getPasswordHistory(), policy, hasher)) {
            throw new PasswordPolicyViolationException(
                    List.of("Password must differ from the last " + policy.historyCount() + " passwords"));
        }
        return hash(newPassword);
    }

    private void saveMfaState(User changed) {
        Instant now = clock.instant();
        users.update(changed.getId(), changed.getTenantId(), u -> {
            u.copyMfaStateFrom(changed);
            u.setUpdatedAt(now);
        });
    }

    private void registerFailedAttempt(User user, Instant now, RequestContext context) {
        PasswordPolicy policy = policies.getPolicy(user.getTenantId());
        FailedLoginOutcome outcome = users.recordFailedLogin(user.getId(), user.getTenantId(),
                policy.lockoutAttempts(), now.plus(policy.lockoutDuration()));
        if (outcome.lockedNow()) {
            metrics.accountLocked();
            log.warn("User {} locked until {} after {} failed attempts",
                    user.getId(), outcome.lockedUntil(), outcome.attempts());
            audit.log(user.getTenantId(), AuditEventType.ACCOUNT_LOCKED, "Account locked", false,
                    AuditDetails.of(user).withRequest(context).with("attempts", outcome.attempts()));
        }
    }

    private boolean verifyLoginMfa(User user, String code) {
        for (MfaMethod method : user.getMfaMethods()) {
            if (mfa.verify(user, code, method)) {
                return true;
            }
        }
        Optional<String> backup = mfa.matchBackupCode(user, code);
        if (backup.isEmpty()) {
            return false;
        }
        AtomicBoolean removed = new AtomicBoolean();
        User after = users.update(user.getId(), user.getTenantId(),
                u -> removed.set(u.removeBackupCodeHash(backup.get())));
        if (!removed.get()) {
            log.debug("Backup code of user {} was already used", user.getId());
            return false;
        }
        log.info("Backup code used by user {}, {} left", user.getId(), after.getBackupCodeHashes().size());
        return true;
    }

    private InvalidCredentialsException loginFailure(UUID tenantId, User user, String email, String reason,
                                                     RequestContext context) {
        metrics.loginFailed(reason);
        log.info("Login failed for {} in tenant {}: {}", SensitiveDataRedactor.maskEmail(email), tenantId, reason);
        AuditDetails details = user != null ? AuditDetails.of(user) : AuditDetails.none().withUser(null, email);
        audit.log(tenantId, AuditEventType.LOGIN_FAILED, "Login failed", false,
                details.withRequest(context).with("reason", reason));
        return new InvalidCredentialsException();
    }

    private boolean verifyPassword(String password, String hash) {
        if (hash == null) {
            return metrics.timePasswordHash(() -> {
                hasher.dummyVerify(password);
                return false;
            });
        }
        return metrics.timePasswordHash(() -> hasher.verifyWithin(password, hash, settings.hashTimeout()));
    }

    private String hash(String password) {
        return metrics.timePasswordHash(() -> hasher.hashWithin(password, settings.hashTimeout()));
    }

    private void sendVerification(User user, String token) {
        notifications.send(NotificationChannel.EMAIL, user.getEmail(), "Verify your email",
                "Use this token to verify your email address: " + token);
    }

    private void enforceUserQuota(UUID tenantId) {
        int maxUsers = tenants.findById(tenantId).map(t -> t.quotas().maxUsers()).orElse(0);
        if (maxUsers > 0 && users.countByTenant(tenantId) >= maxUsers) {
            throw new IllegalArgumentException("Tenant user limit of " + maxUsers + " reached");
        }
    }

    private int sessionLimit(UUID tenantId) {
        return tenants.findById(tenantId)
                .map(Tenant::quotas)
                .map(q -> q.maxSessionsPerUser())
                .filter(limit -> limit > 0)
                .orElse(sessions.settings().maxConcurrent());
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }
}
