package com.warden.security.audit;

import com.warden.observability.CorrelationContext;
import com.warden.observability.CorrelationContextHolder;
import com.warden.observability.SensitiveDataRedactor;
import com.warden.security.testing.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

@DisplayName("AuditLogger")
class AuditLoggerTest {

    private final MutableClock clock = MutableClock.startingAtEpochOf2024();
    private final InMemoryAuditEventStore store = new InMemoryAuditEventStore();
    private final UUID tenantA = UUID.randomUUID();
    private final UUID tenantB = UUID.randomUUID();

    @AfterEach
    void tearDown() {
        CorrelationContextHolder.clear();
    }

    private AuditLogger synchronousLogger(AuditEventStore target) {
        return new AuditLogger(target, Runnable::run, new SensitiveDataRedactor(), clock);
    }

    @Nested
    @DisplayName("recording")
    class Recording {

        @Test
        @DisplayName("stores the event with a timestamp and redacted metadata")
        void redacts() {
            AuditLogger audit = synchronousLogger(store);
            audit.log(tenantA, AuditEventType.LOGIN_FAILED, "Login failed", false,
                    AuditDetails.none().with("password", "hunter2").with("reason", "bad_password"));

            AuditEvent event = store.recent(tenantA, 10).get(0);
            assertThat(event.eventType()).isEqualTo(AuditEventType.LOGIN_FAILED);
            assertThat(event.success()).isFalse();
            assertThat(event.timestamp()).isEqualTo(clock.instant());
            assertThat(event.metadata())
                    .containsEntry("password", SensitiveDataRedactor.REDACTED)
                    .containsEntry("reason", "bad_password");
        }

        @Test
        @DisplayName("captures the caller's correlation id")
        void correlationId() {
            CorrelationContextHolder.set(CorrelationContext.start("corr-123", "10.0.0.1"));
            synchronousLogger(store).log(tenantA, AuditEventType.LOGOUT, "User logged out", true, null);

            assertThat(store.recent(tenantA, 1).get(0).correlationId()).isEqualTo("corr-123");
        }

        @Test
        @DisplayName("binds the caller's correlation context on the writer thread")
        void contextOnWorker() throws Exception {
            List<String> seen = new CopyOnWriteArrayList<>();
            AuditEventStore threadRecorder = new AuditEventStore() {
                @Override
                public void append(AuditEvent event) {
                    seen.add(CorrelationContextHolder.currentCorrelationId());
                }

                @Override
                public List<AuditEvent> recent(UUID tenantId, int limit) {
                    return List.of();
                }
            };
            ExecutorService worker = Executors.newSingleThreadExecutor();
            try {
                AuditLogger audit = new AuditLogger(threadRecorder, worker, new SensitiveDataRedactor(), clock);
                CorrelationContextHolder.set(CorrelationContext.start("corr-async", null));
                audit.log(tenantA, AuditEventType.LOGIN_SUCCESS, "User logged in", true, AuditDetails.none());
            } finally {
                worker.shutdown();
                assertThat(worker.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
            }
            assertThat(seen).containsExactly("corr-async");
        }

        @Test
        @DisplayName("newest events come first and reads are limited")
        void ordering() {
            AuditLogger audit = synchronousLogger(store);
            audit.log(tenantA, AuditEventType.LOGIN_SUCCESS, "first", true, null);
            audit.log(tenantA, AuditEventType.LOGOUT, "second", true, null);
            audit.log(tenantA, AuditEventType.LOGIN_SUCCESS, "third", true, null);

            assertThat(audit.recent(tenantA, 2)).extracting(AuditEvent::description).containsExactly("third", "second");
        }
    }

    @Test
    @DisplayName("events of one tenant are never read from another")
    void tenantScoped() {
        AuditLogger audit = synchronousLogger(store);
        audit.log(tenantA, AuditEventType.USER_CREATED, "created", true, null);

        assertThat(audit.recent(tenantA, 10)).hasSize(1);
        assertThat(audit.recent(tenantB, 10)).isEmpty();
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("a failing store never reaches the caller")
        void storeFailure() {
            AuditEventStore broken = mock(AuditEventStore.class);
            doThrow(new IllegalStateException("disk full")).when(broken).append(any());

            assertThatCode(() -> synchronousLogger(broken)
                    .log(tenantA, AuditEventType.LOGIN_SUCCESS, "ok", true, AuditDetails.none()))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("a rejecting executor never reaches the caller")
        void rejected() {
            AuditLogger audit = new AuditLogger(store, task -> {
                throw new RejectedExecutionException("queue full");
            }, new SensitiveDataRedactor(), clock);

            assertThatCode(() -> audit.log(tenantA, AuditEventType.LOGIN_SUCCESS, "ok", true, null))
                    .doesNotThrowAnyException();
            assertThat(store.recent(tenantA, 10)).isEmpty();
        }

        @Test
        @DisplayName("an event that cannot be built is dropped")
        void invalidEvent() {
            assertThatCode(() -> synchronousLogger(store).log(null, AuditEventType.LOGOUT, "no tenant", true, null))
                    .doesNotThrowAnyException();
        }
    }

    @Test
    @DisplayName("the in-memory store keeps only the newest events per tenant")
    void capacity() {
        InMemoryAuditEventStore small = new InMemoryAuditEventStore(2);
        AuditLogger audit = synchronousLogger(small);
        for (int i = 0; i < 5; i++) {
            audit.log(tenantA, AuditEventType.LOGIN_SUCCESS, "event-" + i, true,
                    new AuditDetails(null, null, null, null, Map.of("n", i)));
        }

        assertThat(small.recent(tenantA, 10)).extracting(AuditEvent::description).containsExactly("event-4", "event-3");
    }
}
