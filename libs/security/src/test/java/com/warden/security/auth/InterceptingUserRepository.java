package com.warden.security.auth;

import com.warden.security.user.FailedLoginOutcome;
import com.warden.security.user.User;
import com.warden.security.user.UserRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Delegating {@link UserRepository} that runs test hooks at fixed points, so other work can be
 * interleaved with a service operation exactly where a race would happen.
 */
class InterceptingUserRepository implements UserRepository {

    private static final Runnable NOTHING = () -> { };

    private final UserRepository delegate;
    private final AtomicReference<Runnable> beforeNextUpdate = new AtomicReference<>();
    private volatile Runnable afterFindByEmail = NOTHING;
    private volatile Runnable afterFindByPasswordResetToken = NOTHING;
    private volatile Runnable beforeEmailVerification = NOTHING;

    InterceptingUserRepository(UserRepository delegate) {
        this.delegate = delegate;
    }

    /**
     * Runs {@code hook} once, before the next {@link #update} reaches the delegate.
     */
    void onceBeforeUpdate(Runnable hook) {
        beforeNextUpdate.set(hook);
    }

    void afterFindByEmail(Runnable hook) {
        afterFindByEmail = hook;
    }

    void afterFindByPasswordResetToken(Runnable hook) {
        afterFindByPasswordResetToken = hook;
    }

    void beforeEmailVerification(Runnable hook) {
        beforeEmailVerification = hook;
    }

    @Override
    public Optional<User> findById(UUID userId, UUID tenantId) {
        return delegate.findById(userId, tenantId);
    }

    @Override
    public Optional<User> findByEmail(String email, UUID tenantId) {
        Optional<User> found = delegate.findByEmail(email, tenantId);
        afterFindByEmail.run();
        return found;
    }

    @Override
    public Optional<User> findByPasswordResetTokenHash(String tokenHash, UUID tenantId) {
        Optional<User> found = delegate.findByPasswordResetTokenHash(tokenHash, tenantId);
        afterFindByPasswordResetToken.run();
        return found;
    }

    @Override
    public Optional<User> findByEmailVerificationTokenHash(String tokenHash, UUID tenantId) {
        return delegate.findByEmailVerificationTokenHash(tokenHash, tenantId);
    }

    @Override
    public List<User> findAllByTenant(UUID tenantId) {
        return delegate.findAllByTenant(tenantId);
    }

    @Override
    public long countByTenant(UUID tenantId) {
        return delegate.countByTenant(tenantId);
    }

    @Override
    public User insert(User user) {
        return delegate.insert(user);
    }

    @Override
    public User update(UUID userId, UUID tenantId, Consumer<User> change) {
        Runnable hook = beforeNextUpdate.getAndSet(null);
        if (hook != null) {
            hook.run();
        }
        return delegate.update(userId, tenantId, change);
    }

    @Override
    public Optional<User> consumePasswordResetToken(String tokenHash, UUID tenantId, Instant now,
                                                    Consumer<User> change) {
        return delegate.consumePasswordResetToken(tokenHash, tenantId, now, change);
    }

    @Override
    public Optional<User> consumeEmailVerificationToken(String tokenHash, UUID tenantId, Instant now,
                                                        Consumer<User> change) {
        beforeEmailVerification.run();
        return delegate.consumeEmailVerificationToken(tokenHash, tenantId, now, change);
    }

    @Override
    public FailedLoginOutcome recordFailedLogin(UUID userId, UUID tenantId, int lockoutAttempts, Instant lockUntil) {
        return delegate.recordFailedLogin(userId, tenantId, lockoutAttempts, lockUntil);
    }

    @Override
    public void recordSuccessfulLogin(UUID userId, UUID tenantId, Instant now) {
        delegate.recordSuccessfulLogin(userId, tenantId, now);
    }
}
