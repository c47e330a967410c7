package com.warden.security.user;

import com.warden.security.ResourceNotFoundException;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Thread-safe in-memory {@link UserRepository}.
 * <p>
 * Users are keyed by {@code (tenantId, userId)}; a second index maps {@code (tenantId, email)}
 * to the user id and enforces uniqueness. Every write replaces the stored user with a changed
 * copy inside {@link ConcurrentHashMap#computeIfPresent}, which serialises writes on the entry;
 * stored instances are never mutated after they are published.
 */
public class InMemoryUserRepository implements UserRepository {

    private record UserKey(UUID tenantId, UUID userId) {
    }

    private record EmailKey(UUID tenantId, String email) {
    }

    private final Map<UserKey, User> users = new ConcurrentHashMap<>();
    private final Map<EmailKey, UUID> emailIndex = new ConcurrentHashMap<>();

    @Override
    public Optional<User> findById(UUID userId, UUID tenantId) {
        if (userId == null || tenantId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(users.get(new UserKey(tenantId, userId))).map(User::copy);
    }

    @Override
    public Optional<User> findByEmail(String email, UUID tenantId) {
        if (email == null || tenantId == null) {
            return Optional.empty();
        }
        UUID userId = emailIndex.get(new EmailKey(tenantId, User.normalizeEmail(email)));
        return userId == null ? Optional.empty() : findById(userId, tenantId);
    }

    @Override
    public Optional<User> findByPasswordResetTokenHash(String tokenHash, UUID tenantId) {
        return findFirst(tenantId, u -> tokenHash != null && tokenHash.equals(u.getPasswordResetTokenHash()));
    }

    @Override
    public Optional<User> findByEmailVerificationTokenHash(String tokenHash, UUID tenantId) {
        return findFirst(tenantId, u -> tokenHash != null && tokenHash.equals(u.getEmailVerificationTokenHash()));
    }

    @Override
    public List<User> findAllByTenant(UUID tenantId) {
        return users.values().stream()
                .filter(u -> u.getTenantId().equals(tenantId))
                .sorted(Comparator.comparing(User::getEmail))
                .map(User::copy)
                .toList();
    }

    @Override
    public long countByTenant(UUID tenantId) {
        return emailIndex.keySet().stream().filter(k -> k.tenantId().equals(tenantId)).count();
    }

    @Override
    public User insert(User user) {
        EmailKey emailKey = new EmailKey(user.getTenantId(), user.getEmail());
        UUID existing = emailIndex.putIfAbsent(emailKey, user.getId());
        if (existing != null) {
            throw new DuplicateUserException("User with email " + user.getEmail() + " already exists in tenant");
        }
        users.put(new UserKey(user.getTenantId(), user.getId()), user.copy());
        return user.copy();
    }

    @Override
    public User update(UUID userId, UUID tenantId, Consumer<User> change) {
        AtomicReference<User> stored = new AtomicReference<>();
        users.computeIfPresent(new UserKey(tenantId, userId), (k, current) -> {
            User next = current.copy();
            change.accept(next);
            if (!current.getEmail().equals(next.getEmail())) {
                reindexEmail(current, next);
            }
            stored.set(next);
            return next;
        });
        if (stored.get() == null) {
            throw new ResourceNotFoundException("User", userId);
        }
        return stored.get().copy();
    }

    @Override
    public Optional<User> consumePasswordResetToken(String tokenHash, UUID tenantId, Instant now,
                                                    Consumer<User> change) {
        return consumeToken(tenantId, tokenHash, now, User::getPasswordResetTokenHash,
                User::getPasswordResetExpires, u -> u.setPasswordResetToken(null, null), change);
    }

    @Override
    public Optional<User> consumeEmailVerificationToken(String tokenHash, UUID tenantId, Instant now,
                                                        Consumer<User> change) {
        return consumeToken(tenantId, tokenHash, now, User::getEmailVerificationTokenHash,
                User::getEmailVerificationExpires, u -> u.setEmailVerificationToken(null, null), change);
    }

    @Override
    public FailedLoginOutcome recordFailedLogin(UUID userId, UUID tenantId, int lockoutAttempts, Instant lockUntil) {
        AtomicReference<FailedLoginOutcome> outcome = new AtomicReference<>();
        users.computeIfPresent(new UserKey(tenantId, userId), (k, current) -> {
            User next = current.copy();
            next.setLoginAttempts(current.getLoginAttempts() + 1);
            boolean lockedNow = next.getLoginAttempts() >= lockoutAttempts;
            if (lockedNow) {
                next.setLockedUntil(lockUntil);
            }
            outcome.set(new FailedLoginOutcome(next.getLoginAttempts(), next.getLockedUntil(), lockedNow));
            return next;
        });
        if (outcome.get() == null) {
            throw new ResourceNotFoundException("User", userId);
        }
        return outcome.get();
    }

    @Override
    public void recordSuccessfulLogin(UUID userId, UUID tenantId, Instant now) {
        users.computeIfPresent(new UserKey(tenantId, userId), (k, current) -> {
            User next = current.copy();
            next.clearLockout();
            next.setLastLoginAt(now);
            return next;
        });
    }

    private void reindexEmail(User current, User updated) {
        EmailKey newKey = new EmailKey(updated.getTenantId(), updated.getEmail());
        UUID holder = emailIndex.putIfAbsent(newKey, updated.getId());
        if (holder != null && !holder.equals(updated.getId())) {
            throw new DuplicateUserException("User with email " + updated.getEmail() + " already exists in tenant");
        }
        emailIndex.remove(new EmailKey(current.getTenantId(), current.getEmail()));
    }

    /**
     * Locates the holder of the token, then re-checks the hash inside {@code compute} so that a
     * concurrent consumer which got there first wins and this call comes back empty.
     */
    private Optional<User> consumeToken(UUID tenantId, String tokenHash, Instant now,
                                        Function<User, String> hashOf,
                                        Function<User, Instant> expiryOf,
                                        Consumer<User> clear,
                                        Consumer<User> change) {
        if (tokenHash == null || tenantId == null) {
            return Optional.empty();
        }
        Optional<UserKey> holder = users.entrySet().stream()
                .filter(e -> e.getKey().tenantId().equals(tenantId))
                .filter(e -> tokenHash.equals(hashOf.apply(e.getValue())))
                .map(Map.Entry::getKey)
                .findFirst();
        if (holder.isEmpty()) {
            return Optional.empty();
        }
        AtomicReference<User> consumed = new AtomicReference<>();
        users.computeIfPresent(holder.get(), (k, current) -> {
            if (!tokenHash.equals(hashOf.apply(current))) {
                return current;
            }
            User next = current.copy();
            clear.accept(next);
            Instant expires = expiryOf.apply(current);
            if (expires != null && expires.isAfter(now)) {
                change.accept(next);
                consumed.set(next);
            }
            return next;
        });
        return Optional.ofNullable(consumed.get()).map(User::copy);
    }

    private Optional<User> findFirst(UUID tenantId, Predicate<User> predicate) {
        if (tenantId == null) {
            return Optional.empty();
        }
        return users.values().stream()
                .filter(u -> u.getTenantId().equals(tenantId))
                .filter(predicate)
                .findFirst()
                .map(User::copy);
    }
}
