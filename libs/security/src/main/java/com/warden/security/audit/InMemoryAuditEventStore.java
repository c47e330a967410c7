package com.warden.security.audit;

import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Keeps the most recent events of each tenant in memory, dropping the oldest beyond a
 * per-tenant capacity.
 */
public class InMemoryAuditEventStore implements AuditEventStore {

    public static final int DEFAULT_CAPACITY_PER_TENANT = 10_000;

    private final int capacityPerTenant;
    private final Map<UUID, Deque<AuditEvent>> events = new ConcurrentHashMap<>();

    public InMemoryAuditEventStore() {
        this(DEFAULT_CAPACITY_PER_TENANT);
    }

    public InMemoryAuditEventStore(int capacityPerTenant) {
        if (capacityPerTenant <= 0) {
            throw new IllegalArgumentException("capacityPerTenant must be positive");
        }
        this.capacityPerTenant = capacityPerTenant;
    }

    @Override
    public void append(AuditEvent event) {
        Deque<AuditEvent> tenantEvents = events.computeIfAbsent(event.tenantId(), id -> new ConcurrentLinkedDeque<>());
        tenantEvents.addFirst(event);
        while (tenantEvents.size() > capacityPerTenant) {
            tenantEvents.pollLast();
        }
    }

    @Override
    public List<AuditEvent> recent(UUID tenantId, int limit) {
        Deque<AuditEvent> tenantEvents = events.get(tenantId);
        if (tenantEvents == null || limit <= 0) {
            return List.of();
        }
        List<AuditEvent> result = new ArrayList<>(Math.min(limit, tenantEvents.size()));
        Iterator<AuditEvent> it = tenantEvents.iterator();
        while (it.hasNext() && result.size() < limit) {
            result.add(it.next());
        }
        return List.copyOf(result);
    }
}
