package com.warden.security.audit;

import com.warden.observability.CorrelationContextHolder;
import com.warden.observability.SensitiveDataRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fire-and-forget audit trail.
 * <p>
 * The event is built on the calling thread (metadata redacted, correlation id captured) and
 * written on the given {@link Executor} with the caller's correlation context bound. A failing
 * write is logged at warn and never reaches the caller.
 */
public class AuditLogger {

    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);

    private final AuditEventStore store;
    private final Executor executor;
    private final SensitiveDataRedactor redactor;
    private final Clock clock;

    public AuditLogger(AuditEventStore store, Executor executor, SensitiveDataRedactor redactor, Clock clock) {
        this.store = store;
        this.executor = executor;
        this.redactor = redactor;
        this.clock = clock;
    }

    public void log(UUID tenantId, AuditEventType eventType, String description, boolean success, AuditDetails details) {
        AuditDetails d = details == null ? AuditDetails.none() : details;
        AuditEvent event;
        try {
            event = new AuditEvent(
                    UUID.randomUUID(),
                    tenantId,
                    eventType,
                    description,
                    success,
                    d.userId(),
                    d.userEmail(),
                    d.ipAddress(),
                    d.userAgent(),
                    CorrelationContextHolder.currentCorrelationId(),
                    redactor.redact(d.metadata()),
                    clock.instant());
        } catch (RuntimeException e) {
            log.warn("Dropped audit event {}: {}", eventType, e.getMessage());
            return;
        }
        log(event);
    }

    public void log(AuditEvent event) {
        var context = CorrelationContextHolder.get().orElse(null);
        try {
            executor.execute(() -> CorrelationContextHolder.runWithContext(context, () -> write(event)));
        } catch (RejectedExecutionException e) {
            log.warn("Audit executor rejected {} event for tenant {}", event.eventType().value(), event.tenantId());
        }
    }

    public List<AuditEvent> recent(UUID tenantId, int limit) {
        return store.recent(tenantId, limit);
    }

    private void write(AuditEvent event) {
        try {
            store.append(event);
            log.debug("Audit {} success={} tenant={}", event.eventType().value(), event.success(), event.tenantId());
        } catch (RuntimeException e) {
            log.warn("Failed to write {} audit event for tenant {}", event.eventType().value(), event.tenantId(), e);
        }
    }
}
