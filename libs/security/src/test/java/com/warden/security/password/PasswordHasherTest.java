package com.warden.security.password;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PasswordHasher")
class PasswordHasherTest {

    private final PasswordHasher hasher = new PasswordHasher(PasswordHasher.MIN_COST);

    @AfterEach
    void tearDown() {
        hasher.close();
    }

    @Nested
    @DisplayName("hash / verify")
    class HashAndVerify {

        @ParameterizedTest
        @ValueSource(strings = {"Str0ng!Passw0rd#2024", "short", "ünïcødé-paß", "with spaces inside"})
        @DisplayName("a hash verifies its own password")
        void roundTrip(String password) {
            assertThat(hasher.verify(password, hasher.hash(password))).isTrue();
        }

        @Test
        @DisplayName("two hashes of one password differ and both verify")
        void saltIsRandom() {
            String first = hasher.hash("Str0ng!Passw0rd#2024");
            String second = hasher.hash("Str0ng!Passw0rd#2024");

            assertThat(first).isNotEqualTo(second);
            assertThat(hasher.verify("Str0ng!Passw0rd#2024", first)).isTrue();
            assertThat(hasher.verify("Str0ng!Passw0rd#2024", second)).isTrue();
        }

        @Test
        @DisplayName("a wrong password does not verify")
        void wrongPassword() {
            assertThat(hasher.verify("Str0ng!Passw0rd#2025", hasher.hash("Str0ng!Passw0rd#2024"))).isFalse();
        }

        @Test
        @DisplayName("hash uses the configured cost")
        void usesCost() {
            assertThat(hasher.hash("x1!Password")).startsWith("$2a$04$");
        }
    }

    @Nested
    @DisplayName("degenerate input")
    class DegenerateInput {

        @Test
        @DisplayName("null, empty and blank passwords hash to null")
        void blankHashesToNull() {
            assertThat(hasher.hash(null)).isNull();
            assertThat(hasher.hash("")).isNull();
            assertThat(hasher.hash("   ")).isNull();
        }

        @Test
        @DisplayName("verify returns false for null input")
        void nullVerify() {
            String hash = hasher.hash("secret-value");
            assertThat(hasher.verify(null, hash)).isFalse();
            assertThat(hasher.verify("secret-value", null)).isFalse();
        }

        @Test
        @DisplayName("verify returns false for a malformed hash")
        void malformedHash() {
            assertThat(hasher.verify("secret-value", "not-a-bcrypt-hash")).isFalse();
            assertThat(hasher.verify("secret-value", "$2a$")).isFalse();
        }

        @Test
        @DisplayName("rejects a cost outside 4..31")
        void rejectsCost() {
            assertThatThrownBy(() -> new PasswordHasher(3)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new PasswordHasher(32)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("time-bounded variants")
    class TimeBounded {

        @Test
        @DisplayName("complete normally within the timeout")
        void withinTimeout() {
            String hash = hasher.hashWithin("Str0ng!Passw0rd#2024", Duration.ofSeconds(5));
            assertThat(hasher.verifyWithin("Str0ng!Passw0rd#2024", hash, Duration.ofSeconds(5))).isTrue();
        }

        @Test
        @DisplayName("give up when the worker pool is busy")
        void timeout() throws Exception {
            ExecutorService single = Executors.newSingleThreadExecutor();
            CountDownLatch release = new CountDownLatch(1);
            single.submit(() -> {
                release.await();
                return null;
            });
            try (PasswordHasher blocked = new PasswordHasher(PasswordHasher.MIN_COST, single)) {
                String hash = hasher.hash("Str0ng!Passw0rd#2024");

                assertThatThrownBy(() -> blocked.hashWithin("Str0ng!Passw0rd#2024", Duration.ofMillis(50)))
                        .isInstanceOf(PasswordHashingException.class)
                        .hasMessageContaining("exceeded");
                assertThat(blocked.verifyWithin("Str0ng!Passw0rd#2024", hash, Duration.ofMillis(50))).isFalse();
            } finally {
                release.countDown();
                single.shutdownNow();
            }
        }

        @Test
        @DisplayName("report a rejected task as a hashing failure")
        void rejected() {
            ExecutorService closed = Executors.newSingleThreadExecutor();
            closed.shutdown();
            try (PasswordHasher hasherOnClosedPool = new PasswordHasher(PasswordHasher.MIN_COST, closed)) {
                assertThatThrownBy(() -> hasherOnClosedPool.hashWithin("Str0ng!Passw0rd#2024", Duration.ofSeconds(1)))
                        .isInstanceOf(PasswordHashingException.class);
            }
        }
    }
}
