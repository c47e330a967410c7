package com.warden.security.user;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Tenant-scoped user persistence. There is deliberately no lookup by id alone.
 * <p>
 * Implementations return copies. Every write is a change applied to the stored user atomically,
 * so concurrent writers to the same user never lose each other's updates.
 */
public interface UserRepository {

    Optional<User> findById(UUID userId, UUID tenantId);

    Optional<User> findByEmail(String email, UUID tenantId);

    Optional<User> findByPasswordResetTokenHash(String tokenHash, UUID tenantId);

    Optional<User> findByEmailVerificationTokenHash(String tokenHash, UUID tenantId);

    List<User> findAllByTenant(UUID tenantId);

    long countByTenant(UUID tenantId);

    /**
     * @throws DuplicateUserException if {@code (tenantId, email)} is already taken
     */
    User insert(User user);

    /**
     * Applies {@code change} to the stored user and returns a copy of the result. If
     * {@code change} throws, the stored user is left untouched.
     *
     * @throws com.warden.security.ResourceNotFoundException if the user does not exist in the tenant
     * @throws DuplicateUserException if the change moves the email onto one taken in the tenant
     */
    User update(UUID userId, UUID tenantId, Consumer<User> change);

    /**
     * Clears the password reset token matching {@code tokenHash}. When the token had not expired
     * at {@code now}, {@code change} is applied in the same step and the updated user returned.
     * Only one caller can ever receive a given token's user.
     *
     * @return empty for an unknown, already used or expired token
     */
    Optional<User> consumePasswordResetToken(String tokenHash, UUID tenantId, Instant now, Consumer<User> change);

    /**
     * Email verification counterpart of {@link #consumePasswordResetToken}.
     */
    Optional<User> consumeEmailVerificationToken(String tokenHash, UUID tenantId, Instant now, Consumer<User> change);

    /**
     * Increments the failed-login counter and, once it reaches {@code lockoutAttempts}, sets
     * {@code lockedUntil}. Read-modify-write is atomic per user.
     */
    FailedLoginOutcome recordFailedLogin(UUID userId, UUID tenantId, int lockoutAttempts, Instant lockUntil);

    /**
     * Clears the failed-login counter and lock and stamps {@code lastLoginAt}.
     */
    void recordSuccessfulLogin(UUID userId, UUID tenantId, Instant now);
}
