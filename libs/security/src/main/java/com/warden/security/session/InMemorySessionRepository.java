package com.warden.security.session;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

public class InMemorySessionRepository implements SessionRepository {

    private record SessionKey(UUID tenantId, UUID sessionId) {
    }

    private final Map<SessionKey, Session> sessions = new ConcurrentHashMap<>();

    @Override
    public Session insert(Session session) {
        Session existing = sessions.putIfAbsent(new SessionKey(session.tenantId(), session.id()), session);
        if (existing != null) {
            throw new IllegalStateException("Session already exists: " + session.id());
        }
        return session;
    }

    @Override
    public Optional<Session> findById(UUID sessionId, UUID tenantId) {
        if (sessionId == null || tenantId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(new SessionKey(tenantId, sessionId)));
    }

    @Override
    public List<Session> findByUser(UUID userId, UUID tenantId) {
        return sessions.values().stream()
                .filter(s -> s.tenantId().equals(tenantId) && s.userId().equals(userId))
                .sorted(Comparator.comparing(Session::createdAt))
                .toList();
    }

    @Override
    public Optional<Session> update(UUID sessionId, UUID tenantId, UnaryOperator<Session> change) {
        if (sessionId == null || tenantId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.computeIfPresent(new SessionKey(tenantId, sessionId),
                (k, current) -> change.apply(current)));
    }
}
