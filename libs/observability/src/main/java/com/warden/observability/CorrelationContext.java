package com.warden.observability;

import java.util.UUID;

/**
 * Immutable per-request context used to correlate log lines and audit events.
 * <p>
 * The HTTP layer establishes one context per inbound request. Tenant, user and session
 * identifiers are filled in as soon as they are known (after tenant resolution and bearer
 * authentication) so that every log statement emitted while serving the request carries them.
 *
 * @param correlationId identifier of the business flow, propagated from {@code X-Correlation-ID}
 * @param tenantId      resolved tenant (nullable before tenant resolution)
 * @param userId        authenticated user (nullable for anonymous requests such as login)
 * @param sessionId     session backing the bearer token (nullable)
 * @param requestId     identifier of this specific request
 * @param clientIp      remote address of the caller (nullable)
 */
public record CorrelationContext(
        String correlationId,
        String tenantId,
        String userId,
        String sessionId,
        String requestId,
        String clientIp
) {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_TENANT_ID = "tenantId";
    public static final String MDC_USER_ID = "userId";
    public static final String MDC_SESSION_ID = "sessionId";
    public static final String MDC_REQUEST_ID = "requestId";
    public static final String MDC_CLIENT_IP = "clientIp";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Starts a context for a new request with a fresh request id.
     */
    public static CorrelationContext start(String correlationId, String clientIp) {
        return new CorrelationContext(correlationId, null, null, null, UUID.randomUUID().toString(), clientIp);
    }

    public CorrelationContext withTenant(String tenantId) {
        return new CorrelationContext(correlationId, tenantId, userId, sessionId, requestId, clientIp);
    }

    public CorrelationContext withPrincipal(String userId, String sessionId) {
        return new CorrelationContext(correlationId, tenantId, userId, sessionId, requestId, clientIp);
    }
}
