package com.warden.security.user;

import com.warden.security.Permission;
import com.warden.security.Role;
import com.warden.security.mfa.MfaMethod;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * A user account inside one tenant.
 * <p>
 * Mutable so that a single {@link UserRepository#update(UUID, UUID, java.util.function.Consumer)}
 * can apply several changes at once. Repositories hand out copies: changing an instance has no
 * effect on stored state. The email is always stored lower-case.
 */
public class User {

    private final UUID id;
    private final UUID tenantId;
    private String email;
    private String firstName;
    private String lastName;
    private String displayName;

    private String passwordHash;
    private List<String> passwordHistory = new ArrayList<>();
    private Instant passwordChangedAt;
    private boolean requirePasswordChange;

    private Role role = Role.DEVELOPER;
    private UserStatus status = UserStatus.PENDING_ACTIVATION;
    private Set<Permission> permissions = EnumSet.noneOf(Permission.class);

    private boolean mfaEnabled;
    private String mfaSecret;
    private String pendingMfaSecret;
    private Set<MfaMethod> mfaMethods = EnumSet.noneOf(MfaMethod.class);
    private String mfaPhoneNumber;
    private Set<String> backupCodeHashes = new LinkedHashSet<>();

    private int loginAttempts;
    private Instant lockedUntil;
    private Instant lastLoginAt;

    private String passwordResetTokenHash;
    private Instant passwordResetExpires;
    private boolean emailVerified;
    private String emailVerificationTokenHash;
    private Instant emailVerificationExpires;

    private Instant createdAt;
    private Instant updatedAt;

    public User(UUID id, UUID tenantId, String email) {
        if (id == null || tenantId == null) {
            throw new IllegalArgumentException("id and tenantId must not be null");
        }
        this.id = id;
        this.tenantId = tenantId;
        setEmail(email);
    }

    /**
     * Deep copy; collections are duplicated so the copy can be changed independently.
     */
    public User copy() {
        User c = new User(id, tenantId, email);
        c.firstName = firstName;
        c.lastName = lastName;
        c.displayName = displayName;
        c.passwordHash = passwordHash;
        c.passwordHistory = new ArrayList<>(passwordHistory);
        c.passwordChangedAt = passwordChangedAt;
        c.requirePasswordChange = requirePasswordChange;
        c.role = role;
        c.status = status;
        c.permissions = permissions.isEmpty() ? EnumSet.noneOf(Permission.class) : EnumSet.copyOf(permissions);
        c.mfaEnabled = mfaEnabled;
        c.mfaSecret = mfaSecret;
        c.pendingMfaSecret = pendingMfaSecret;
        c.mfaMethods = mfaMethods.isEmpty() ? EnumSet.noneOf(MfaMethod.class) : EnumSet.copyOf(mfaMethods);
        c.mfaPhoneNumber = mfaPhoneNumber;
        c.backupCodeHashes = new LinkedHashSet<>(backupCodeHashes);
        c.loginAttempts = loginAttempts;
        c.lockedUntil = lockedUntil;
        c.lastLoginAt = lastLoginAt;
        c.passwordResetTokenHash = passwordResetTokenHash;
        c.passwordResetExpires = passwordResetExpires;
        c.emailVerified = emailVerified;
        c.emailVerificationTokenHash = emailVerificationTokenHash;
        c.emailVerificationExpires = emailVerificationExpires;
        c.createdAt = createdAt;
        c.updatedAt = updatedAt;
        return c;
    }

    /**
     * Role defaults plus individually granted permissions.
     */
    public Set<Permission> effectivePermissions() {
        Set<Permission> effective = EnumSet.noneOf(Permission.class);
        effective.addAll(role.defaultPermissions());
        effective.addAll(permissions);
        return effective;
    }

    public boolean isLocked(Instant now) {
        return lockedUntil != null && lockedUntil.isAfter(now);
    }

    /**
     * Replaces the password hash, pushing the previous one onto the history (bounded).
     */
    public void changePasswordHash(String newHash, Instant now, int historyLimit) {
        if (passwordHash != null) {
            passwordHistory.add(0, passwordHash);
            while (passwordHistory.size() > historyLimit) {
                passwordHistory.remove(passwordHistory.size() - 1);
            }
        }
        passwordHash = newHash;
        passwordChangedAt = now;
        requirePasswordChange = false;
    }

    /**
     * Takes over every MFA field of {@code source}: enrollment state, secrets, phone number and
     * backup codes.
     */
    public void copyMfaStateFrom(User source) {
        mfaEnabled = source.mfaEnabled;
        mfaSecret = source.mfaSecret;
        pendingMfaSecret = source.pendingMfaSecret;
        setMfaMethods(source.mfaMethods);
        mfaPhoneNumber = source.mfaPhoneNumber;
        backupCodeHashes = new LinkedHashSet<>(source.backupCodeHashes);
    }

    public void clearLockout() {
        loginAttempts = 0;
        lockedUntil = null;
    }

    public String fullName() {
        if (displayName != null && !displayName.isBlank()) {
            return displayName;
        }
        return ((firstName != null ? firstName : "") + " " + (lastName != null ? lastName : "")).trim();
    }

    public UUID getId() {
        return id;
    }

    public UUID getTenantId() {
        return tenantId;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email must not be null or blank");
        }
        this.email = normalizeEmail(email);
    }

    public static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }

    public String getFirstName() {
        return firstName;
    }

    public void setFirstName(String firstName) {
        this.firstName = firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public void setLastName(String lastName) {
        this.lastName = lastName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public void setPasswordHash(String passwordHash) {
        this.passwordHash = passwordHash;
    }

    public List<String> getPasswordHistory() {
        return List.copyOf(passwordHistory);
    }

    public Instant getPasswordChangedAt() {
        return passwordChangedAt;
    }

    public void setPasswordChangedAt(Instant passwordChangedAt) {
        this.passwordChangedAt = passwordChangedAt;
    }

    public boolean isRequirePasswordChange() {
        return requirePasswordChange;
    }

    public void setRequirePasswordChange(boolean requirePasswordChange) {
        this.requirePasswordChange = requirePasswordChange;
    }

    public Role getRole() {
        return role;
    }

    public void setRole(Role role) {
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
        this.role = role;
    }

    public UserStatus getStatus() {
        return status;
    }

    public void setStatus(UserStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        this.status = status;
    }

    public Set<Permission> getPermissions() {
        return Set.copyOf(permissions);
    }

    public void setPermissions(Set<Permission> permissions) {
        this.permissions = permissions == null || permissions.isEmpty()
                ? EnumSet.noneOf(Permission.class)
                : EnumSet.copyOf(permissions);
    }

    public boolean isMfaEnabled() {
        return mfaEnabled;
    }

    public void setMfaEnabled(boolean mfaEnabled) {
        this.mfaEnabled = mfaEnabled;
    }

    public String getMfaSecret() {
        return mfaSecret;
    }

    public void setMfaSecret(String mfaSecret) {
        this.mfaSecret = mfaSecret;
    }

    public String getPendingMfaSecret() {
        return pendingMfaSecret;
    }

    public void setPendingMfaSecret(String pendingMfaSecret) {
        this.pendingMfaSecret = pendingMfaSecret;
    }

    public Set<MfaMethod> getMfaMethods() {
        return Set.copyOf(mfaMethods);
    }

    public void setMfaMethods(Set<MfaMethod> mfaMethods) {
        this.mfaMethods = mfaMethods == null || mfaMethods.isEmpty()
                ? EnumSet.noneOf(MfaMethod.class)
                : EnumSet.copyOf(mfaMethods);
    }

    public String getMfaPhoneNumber() {
        return mfaPhoneNumber;
    }

    public void setMfaPhoneNumber(String mfaPhoneNumber) {
        this.mfaPhoneNumber = mfaPhoneNumber;
    }

    public Set<String> getBackupCodeHashes() {
        return Set.copyOf(backupCodeHashes);
    }

    public void setBackupCodeHashes(Set<String> backupCodeHashes) {
        this.backupCodeHashes = backupCodeHashes == null ? new LinkedHashSet<>() : new LinkedHashSet<>(backupCodeHashes);
    }

    public boolean removeBackupCodeHash(String hash) {
        return backupCodeHashes.remove(hash);
    }

    public int getLoginAttempts() {
        return loginAttempts;
    }

    public void setLoginAttempts(int loginAttempts) {
        this.loginAttempts = loginAttempts;
    }

    public Instant getLockedUntil() {
        return lockedUntil;
    }

    public void setLockedUntil(Instant lockedUntil) {
        this.lockedUntil = lockedUntil;
    }

    public Instant getLastLoginAt() {
        return lastLoginAt;
    }

    public void setLastLoginAt(Instant lastLoginAt) {
        this.lastLoginAt = lastLoginAt;
    }

    public String getPasswordResetTokenHash() {
        return passwordResetTokenHash;
    }

    public Instant getPasswordResetExpires() {
        return passwordResetExpires;
    }

    public void setPasswordResetToken(String tokenHash, Instant expires) {
        this.passwordResetTokenHash = tokenHash;
        this.passwordResetExpires = expires;
    }

    public boolean isEmailVerified() {
        return emailVerified;
    }

    public void setEmailVerified(boolean emailVerified) {
        this.emailVerified = emailVerified;
    }

    public String getEmailVerificationTokenHash() {
        return emailVerificationTokenHash;
    }

    public Instant getEmailVerificationExpires() {
        return emailVerificationExpires;
    }

    public void setEmailVerificationToken(String tokenHash, Instant expires) {
        this.emailVerificationTokenHash = tokenHash;
        this.emailVerificationExpires = expires;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    @Override
    public String toString() {
        return "User{id=" + id + ", tenantId=" + tenantId + ", role=" + role + ", status=" + status + "}";
    }
}
