package com.warden.security.audit;

import com.warden.security.session.RequestContext;
import com.warden.security.user.User;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Optional context attached to an audit entry. Every field may be null.
 */
public record AuditDetails(
        UUID userId,
        String userEmail,
        String ipAddress,
        String userAgent,
        Map<String, Object> metadata
) {

    public AuditDetails {
        metadata = metadata == null ? Map.of() : metadata;
    }

    public static AuditDetails none() {
        return new AuditDetails(null, null, null, null, Map.of());
    }

    public static AuditDetails of(User user) {
        return new AuditDetails(user.getId(), user.getEmail(), null, null, Map.of());
    }

    public AuditDetails withUser(UUID id, String email) {
        return new AuditDetails(id, email, ipAddress, userAgent, metadata);
    }

    public AuditDetails withRequest(RequestContext context) {
        if (context == null) {
            return this;
        }
        return new AuditDetails(userId, userEmail, context.ipAddress(), context.userAgent(), metadata);
    }

    public AuditDetails with(String key, Object value) {
        Map<String, Object> next = new LinkedHashMap<>(metadata);
        next.put(key, value);
        return new AuditDetails(userId, userEmail, ipAddress, userAgent, next);
    }
}
