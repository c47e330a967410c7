package com.warden.security.user;

import com.warden.security.ResourceNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("InMemoryUserRepository")
class InMemoryUserRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private final InMemoryUserRepository repository = new InMemoryUserRepository();
    private final UUID tenantA = UUID.randomUUID();
    private final UUID tenantB = UUID.randomUUID();

    private User newUser(UUID tenantId, String email) {
        User user = new User(UUID.randomUUID(), tenantId, email);
        user.setStatus(UserStatus.ACTIVE);
        return user;
    }

    @Nested
    @DisplayName("tenant isolation")
    class TenantIsolation {

        @Test
        @DisplayName("the same email may exist once per tenant")
        void sameEmailTwoTenants() {
            User inA = repository.insert(newUser(tenantA, "alice@example.com"));
            User inB = repository.insert(newUser(tenantB, "alice@example.com"));

            assertThat(repository.findByEmail("alice@example.com", tenantA)).map(User::getId).contains(inA.getId());
            assertThat(repository.findByEmail("alice@example.com", tenantB)).map(User::getId).contains(inB.getId());
        }

        @Test
        @DisplayName("a user is not found through another tenant")
        void noCrossTenantLookup() {
            User inA = repository.insert(newUser(tenantA, "alice@example.com"));

            assertThat(repository.findById(inA.getId(), tenantB)).isEmpty();
            assertThat(repository.findByEmail("alice@example.com", tenantB)).isEmpty();
            assertThat(repository.findAllByTenant(tenantB)).isEmpty();
        }

        @Test
        @DisplayName("duplicate email within a tenant is rejected, case-insensitively")
        void duplicate() {
            repository.insert(newUser(tenantA, "alice@example.com"));

            assertThatThrownBy(() -> repository.insert(newUser(tenantA, "Alice@Example.com")))
                    .isInstanceOf(DuplicateUserException.class);
            assertThat(repository.countByTenant(tenantA)).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("copies")
    class Copies {

        @Test
        @DisplayName("changing a returned user does not change stored state")
        void defensiveCopies() {
            User stored = repository.insert(newUser(tenantA, "alice@example.com"));
            User loaded = repository.findById(stored.getId(), tenantA).orElseThrow();
            loaded.setStatus(UserStatus.SUSPENDED);

            assertThat(repository.findById(stored.getId(), tenantA).orElseThrow().getStatus())
                    .isEqualTo(UserStatus.ACTIVE);
        }

        @Test
        @DisplayName("update applies the change and reindexes the email")
        void update() {
            User stored = repository.insert(newUser(tenantA, "alice@example.com"));
            User updated = repository.update(stored.getId(), tenantA, u -> u.setEmail("alice.new@example.com"));

            assertThat(updated.getEmail()).isEqualTo("alice.new@example.com");
            assertThat(repository.findByEmail("alice@example.com", tenantA)).isEmpty();
            assertThat(repository.findByEmail("alice.new@example.com", tenantA)).isPresent();
        }

        @Test
        @DisplayName("update of an unknown user fails")
        void updateUnknown() {
            assertThatThrownBy(() -> repository.update(UUID.randomUUID(), tenantA, u -> u.setFirstName("Ghost")))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("update through another tenant fails")
        void updateWrongTenant() {
            User stored = repository.insert(newUser(tenantA, "alice@example.com"));

            assertThatThrownBy(() -> repository.update(stored.getId(), tenantB, u -> u.setFirstName("Mallory")))
                    .isInstanceOf(ResourceNotFoundException.class);
            assertThat(repository.findById(stored.getId(), tenantA).orElseThrow().getFirstName()).isNull();
        }

        @Test
        @DisplayName("moving the email onto a taken one is rejected and nothing is written")
        void updateDuplicateEmail() {
            repository.insert(newUser(tenantA, "bob@example.com"));
            User alice = repository.insert(newUser(tenantA, "alice@example.com"));

            assertThatThrownBy(() -> repository.update(alice.getId(), tenantA, u -> {
                u.setFirstName("Alice");
                u.setEmail("bob@example.com");
            })).isInstanceOf(DuplicateUserException.class);

            User reloaded = repository.findById(alice.getId(), tenantA).orElseThrow();
            assertThat(reloaded.getEmail()).isEqualTo("alice@example.com");
            assertThat(reloaded.getFirstName()).isNull();
            assertThat(repository.findByEmail("alice@example.com", tenantA)).isPresent();
        }

        @Test
        @DisplayName("a change that throws leaves the stored user untouched")
        void failedChange() {
            User stored = repository.insert(newUser(tenantA, "alice@example.com"));

            assertThatThrownBy(() -> repository.update(stored.getId(), tenantA, u -> {
                u.setStatus(UserStatus.SUSPENDED);
                throw new IllegalStateException("rejected");
            })).isInstanceOf(IllegalStateException.class);

            assertThat(repository.findById(stored.getId(), tenantA).orElseThrow().getStatus())
                    .isEqualTo(UserStatus.ACTIVE);
        }
    }

    @Nested
    @DisplayName("concurrent writers")
    class ConcurrentWriters {

        @Test
        @DisplayName("an update computed after a lockout does not clear the lock")
        void updateKeepsLockout() {
            User user = repository.insert(newUser(tenantA, "alice@example.com"));
            Instant lockUntil = NOW.plusSeconds(1800);
            User snapshot = repository.findById(user.getId(), tenantA).orElseThrow();

            for (int i = 0; i < 5; i++) {
                repository.recordFailedLogin(user.getId(), tenantA, 5, lockUntil);
            }
            repository.update(snapshot.getId(), tenantA, u -> u.setPasswordResetToken("hash", NOW.plusSeconds(3600)));

            User reloaded = repository.findById(user.getId(), tenantA).orElseThrow();
            assertThat(reloaded.getLoginAttempts()).isEqualTo(5);
            assertThat(reloaded.getLockedUntil()).isEqualTo(lockUntil);
            assertThat(reloaded.getPasswordResetTokenHash()).isEqualTo("hash");
        }

        @Test
        @DisplayName("failures recorded while profile updates run are all kept")
        void mixedWriters() throws Exception {
            User user = repository.insert(newUser(tenantA, "alice@example.com"));
            int rounds = 200;
            ExecutorService pool = Executors.newFixedThreadPool(2);
            CountDownLatch start = new CountDownLatch(1);
            Future<?> failures = pool.submit(() -> {
                start.await();
                for (int i = 0; i < rounds; i++) {
                    repository.recordFailedLogin(user.getId(), tenantA, 10_000, NOW);
                }
                return null;
            });
            Future<?> updates = pool.submit(() -> {
                start.await();
                for (int i = 0; i < rounds; i++) {
                    String name = "Alice " + i;
                    repository.update(user.getId(), tenantA, u -> u.setDisplayName(name));
                }
                return null;
            });
            start.countDown();
            failures.get();
            updates.get();
            pool.shutdown();

            User reloaded = repository.findById(user.getId(), tenantA).orElseThrow();
            assertThat(reloaded.getLoginAttempts()).isEqualTo(rounds);
            assertThat(reloaded.getDisplayName()).isEqualTo("Alice " + (rounds - 1));
        }
    }

    @Nested
    @DisplayName("token consumption")
    class TokenConsumption {

        private User withResetToken(String hash, Instant expires) {
            User user = repository.insert(newUser(tenantA, "alice@example.com"));
            return repository.update(user.getId(), tenantA, u -> u.setPasswordResetToken(hash, expires));
        }

        @Test
        @DisplayName("a valid reset token is cleared and the change applied")
        void consumesResetToken() {
            User user = withResetToken("reset-hash", NOW.plusSeconds(3600));

            Optional<User> consumed = repository.consumePasswordResetToken("reset-hash", tenantA, NOW,
                    u -> u.setPasswordHash("new-hash"));

            assertThat(consumed).isPresent();
            User reloaded = repository.findById(user.getId(), tenantA).orElseThrow();
            assertThat(reloaded.getPasswordHash()).isEqualTo("new-hash");
            assertThat(reloaded.getPasswordResetTokenHash()).isNull();
            assertThat(repository.findByPasswordResetTokenHash("reset-hash", tenantA)).isEmpty();
        }

        @Test
        @DisplayName("a token is consumed only once")
        void onlyOnce() {
            withResetToken("reset-hash", NOW.plusSeconds(3600));

            assertThat(repository.consumePasswordResetToken("reset-hash", tenantA, NOW, u -> { })).isPresent();
            assertThat(repository.consumePasswordResetToken("reset-hash", tenantA, NOW, u -> { })).isEmpty();
        }

        @Test
        @DisplayName("an expired token is cleared without applying the change")
        void expired() {
            User user = withResetToken("reset-hash", NOW.minusSeconds(1));

            Optional<User> consumed = repository.consumePasswordResetToken("reset-hash", tenantA, NOW,
                    u -> u.setPasswordHash("new-hash"));

            assertThat(consumed).isEmpty();
            User reloaded = repository.findById(user.getId(), tenantA).orElseThrow();
            assertThat(reloaded.getPasswordHash()).isNull();
            assertThat(reloaded.getPasswordResetTokenHash()).isNull();
        }

        @Test
        @DisplayName("a token cannot be consumed through another tenant")
        void otherTenant() {
            User user = withResetToken("reset-hash", NOW.plusSeconds(3600));

            assertThat(repository.consumePasswordResetToken("reset-hash", tenantB, NOW, u -> { })).isEmpty();
            assertThat(repository.findById(user.getId(), tenantA).orElseThrow().getPasswordResetTokenHash())
                    .isEqualTo("reset-hash");
        }

        @Test
        @DisplayName("two simultaneous reset attempts with one token: exactly one wins")
        void concurrentReset() throws Exception {
            withResetToken("reset-hash", NOW.plusSeconds(3600));
            CyclicBarrier barrier = new CyclicBarrier(2);
            ExecutorService pool = Executors.newFixedThreadPool(2);
            List<Future<Optional<User>>> results = new ArrayList<>();
            for (int t = 0; t < 2; t++) {
                String newHash = "new-hash-" + t;
                results.add(pool.submit(() -> {
                    barrier.await();
                    return repository.consumePasswordResetToken("reset-hash", tenantA, NOW,
                            u -> u.setPasswordHash(newHash));
                }));
            }
            int winners = 0;
            for (Future<Optional<User>> result : results) {
                if (result.get().isPresent()) {
                    winners++;
                }
            }
            pool.shutdown();

            assertThat(winners).isEqualTo(1);
        }

        @Test
        @DisplayName("two simultaneous verifications with one token: exactly one wins")
        void concurrentVerification() throws Exception {
            User user = repository.insert(newUser(tenantA, "alice@example.com"));
            repository.update(user.getId(), tenantA, u -> u.setEmailVerificationToken("verify-hash", NOW.plusSeconds(3600)));
            CyclicBarrier barrier = new CyclicBarrier(2);
            ExecutorService pool = Executors.newFixedThreadPool(2);
            List<Future<Optional<User>>> results = new ArrayList<>();
            for (int t = 0; t < 2; t++) {
                results.add(pool.submit(() -> {
                    barrier.await();
                    return repository.consumeEmailVerificationToken("verify-hash", tenantA, NOW,
                            u -> u.setEmailVerified(true));
                }));
            }
            int winners = 0;
            for (Future<Optional<User>> result : results) {
                if (result.get().isPresent()) {
                    winners++;
                }
            }
            pool.shutdown();

            assertThat(winners).isEqualTo(1);
            User reloaded = repository.findById(user.getId(), tenantA).orElseThrow();
            assertThat(reloaded.isEmailVerified()).isTrue();
            assertThat(reloaded.getEmailVerificationTokenHash()).isNull();
        }
    }

    @Nested
    @DisplayName("failed logins")
    class FailedLogins {

        @Test
        @DisplayName("locks once the threshold is reached")
        void locks() {
            User user = repository.insert(newUser(tenantA, "alice@example.com"));
            Instant lockUntil = NOW.plusSeconds(1800);

            for (int i = 1; i < 5; i++) {
                assertThat(repository.recordFailedLogin(user.getId(), tenantA, 5, lockUntil).lockedNow()).isFalse();
            }
            FailedLoginOutcome fifth = repository.recordFailedLogin(user.getId(), tenantA, 5, lockUntil);

            assertThat(fifth.attempts()).isEqualTo(5);
            assertThat(fifth.lockedNow()).isTrue();
            assertThat(fifth.lockedUntil()).isEqualTo(lockUntil);
        }

        @Test
        @DisplayName("concurrent failures are all counted")
        void atomicIncrement() throws Exception {
            User user = repository.insert(newUser(tenantA, "alice@example.com"));
            int threads = 16;
            int perThread = 25;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        repository.recordFailedLogin(user.getId(), tenantA, 10_000, NOW);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get();
            }
            pool.shutdown();

            assertThat(repository.findById(user.getId(), tenantA).orElseThrow().getLoginAttempts())
                    .isEqualTo(threads * perThread);
        }

        @Test
        @DisplayName("a successful login clears counter and lock")
        void success() {
            User user = repository.insert(newUser(tenantA, "alice@example.com"));
            repository.recordFailedLogin(user.getId(), tenantA, 1, NOW.plusSeconds(60));
            repository.recordSuccessfulLogin(user.getId(), tenantA, NOW);

            User reloaded = repository.findById(user.getId(), tenantA).orElseThrow();
            assertThat(reloaded.getLoginAttempts()).isZero();
            assertThat(reloaded.getLockedUntil()).isNull();
            assertThat(reloaded.getLastLoginAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("recording for a user of another tenant fails")
        void wrongTenant() {
            User user = repository.insert(newUser(tenantA, "alice@example.com"));
            assertThatThrownBy(() -> repository.recordFailedLogin(user.getId(), tenantB, 5, NOW))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }
}
