package com.warden.security.audit;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable record of a security-relevant action within one tenant.
 *
 * @param userId        acting or affected user, may be null
 * @param userEmail     email as known at the time, may be null
 * @param correlationId request correlation id, may be null outside a request
 * @param metadata      additional details, already redacted
 */
public record AuditEvent(
        UUID id,
        UUID tenantId,
        AuditEventType eventType,
        String description,
        boolean success,
        UUID userId,
        String userEmail,
        String ipAddress,
        String userAgent,
        String correlationId,
        Map<String, Object> metadata,
        Instant timestamp
) {

    public AuditEvent {
        if (id == null || tenantId == null || eventType == null || timestamp == null) {
            throw new IllegalArgumentException("id, tenantId, eventType and timestamp must not be null");
        }
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
