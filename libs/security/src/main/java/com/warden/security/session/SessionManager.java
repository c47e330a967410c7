package com.warden.security.session;

import com.warden.security.user.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Creates and tracks sessions.
 * <p>
 * Expiry is applied lazily: an {@code ACTIVE} session read after its {@code expiresAt} is moved to
 * {@code EXPIRED} before being returned. Expire and revoke are idempotent and never revive a
 * session that already reached a final state.
 */
public class SessionManager {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final SessionRepository repository;
    private final SessionSettings settings;
    private final Clock clock;

    public SessionManager(SessionRepository repository, SessionSettings settings, Clock clock) {
        this.repository = repository;
        this.settings = settings;
        this.clock = clock;
    }

    public SessionSettings settings() {
        return settings;
    }

    /**
     * Opens a new ACTIVE session. When a concurrency limit is configured, the user's oldest
     * active sessions are revoked to stay within it.
     */
    public Session create(User user, RequestContext context, boolean rememberMe, boolean mfaVerified) {
        return create(user, context, rememberMe, mfaVerified, settings.maxConcurrent());
    }

    /**
     * Same as {@link #create(User, RequestContext, boolean, boolean)} with an explicit limit,
     * 0 meaning no limit.
     */
    public Session create(User user, RequestContext context, boolean rememberMe, boolean mfaVerified,
                          int maxConcurrent) {
        Instant now = clock.instant();
        RequestContext ctx = context == null ? RequestContext.unknown() : context;
        Session session = new Session(
                UUID.randomUUID(),
                user.getId(),
                user.getTenantId(),
                SessionStatus.ACTIVE,
                ctx.ipAddress(),
                ctx.userAgent(),
                Session.AUTH_METHOD_LOCAL,
                mfaVerified,
                rememberMe,
                now,
                now,
                now.plus(rememberMe ? settings.rememberMeTtl() : settings.ttl()));
        if (maxConcurrent > 0) {
            evictOldest(user, maxConcurrent - 1);
        }
        repository.insert(session);
        log.debug("Session {} created for user {}", session.id(), user.getId());
        return session;
    }

    public Optional<Session> get(UUID sessionId, UUID tenantId) {
        Instant now = clock.instant();
        return repository.findById(sessionId, tenantId).map(session -> {
            if (session.status() == SessionStatus.ACTIVE && !session.expiresAt().isAfter(now)) {
                return repository.update(sessionId, tenantId, this::expireIfDue).orElse(session);
            }
            return session;
        });
    }

    public Optional<Session> findActive(UUID sessionId, UUID tenantId) {
        return get(sessionId, tenantId).filter(s -> s.status() == SessionStatus.ACTIVE);
    }

    public Optional<Session> touch(UUID sessionId, UUID tenantId) {
        Instant now = clock.instant();
        return findActive(sessionId, tenantId)
                .flatMap(s -> repository.update(sessionId, tenantId,
                        current -> current.isActiveAt(now) ? current.withLastActivityAt(now) : current))
                .filter(s -> s.status() == SessionStatus.ACTIVE);
    }

    public Optional<Session> expire(UUID sessionId, UUID tenantId) {
        return repository.update(sessionId, tenantId, s -> s.withStatus(SessionStatus.EXPIRED));
    }

    /**
     * @return the session after the call, empty when it does not exist in the tenant
     */
    public Optional<Session> revoke(UUID sessionId, UUID tenantId) {
        Optional<Session> result = repository.update(sessionId, tenantId, s -> s.withStatus(SessionStatus.REVOKED));
        result.ifPresent(s -> log.debug("Session {} is {}", sessionId, s.status()));
        return result;
    }

    public List<Session> listActive(UUID userId, UUID tenantId) {
        Instant now = clock.instant();
        return repository.findByUser(userId, tenantId).stream()
                .filter(s -> s.isActiveAt(now))
                .toList();
    }

    /**
     * @return number of sessions that were active and are now revoked
     */
    public int revokeAll(UUID userId, UUID tenantId) {
        int revoked = 0;
        for (Session session : listActive(userId, tenantId)) {
            Optional<Session> after = repository.update(session.id(), tenantId, s -> s.withStatus(SessionStatus.REVOKED));
            if (after.isPresent()) {
                revoked++;
            }
        }
        return revoked;
    }

    private void evictOldest(User user, int keep) {
        List<Session> active = listActive(user.getId(), user.getTenantId());
        int excess = active.size() - keep;
        for (int i = 0; i < excess; i++) {
            Session oldest = active.get(i);
            revoke(oldest.id(), oldest.tenantId());
            log.info("Session {} of user {} evicted by concurrent session limit", oldest.id(), user.getId());
        }
    }

    private Session expireIfDue(Session current) {
        if (current.status() == SessionStatus.ACTIVE && !current.expiresAt().isAfter(clock.instant())) {
            return current.withStatus(SessionStatus.EXPIRED);
        }
        return current;
    }
}
