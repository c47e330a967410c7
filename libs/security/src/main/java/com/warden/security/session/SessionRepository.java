package com.warden.security.session;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Session storage. Every lookup is scoped by tenant.
 */
public interface SessionRepository {

    Session insert(Session session);

    Optional<Session> findById(UUID sessionId, UUID tenantId);

    List<Session> findByUser(UUID userId, UUID tenantId);

    /**
     * Atomically replaces the stored session with {@code change.apply(current)}.
     *
     * @return the stored result, empty when no such session exists in the tenant
     */
    Optional<Session> update(UUID sessionId, UUID tenantId, UnaryOperator<Session> change);
}
