package com.warden.security.audit;

import java.util.List;
import java.util.UUID;

/**
 * Append-only audit storage. Reads are always scoped to a single tenant.
 */
public interface AuditEventStore {

    void append(AuditEvent event);

    /**
     * @return up to {@code limit} events of the tenant, newest first
     */
    List<AuditEvent> recent(UUID tenantId, int limit);
}
