package com.warden.security;

import java.util.Optional;

/**
 * Extracts bearer tokens from HTTP {@code Authorization} header values.
 * <p>
 * Only the {@code Bearer} scheme is accepted (case-insensitive), separated from the token by
 * whitespace. {@code Basic ...}, {@code Bearertoken} or a bare token all yield empty.
 */
public final class BearerTokenExtractor {

    private static final String SCHEME = "bearer";

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * @param authorizationHeader the full header value (may be null)
     * @return the token, or empty if the header is missing, uses another scheme, or has no token
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        if (trimmed.length() <= SCHEME.length()
                || !trimmed.regionMatches(true, 0, SCHEME, 0, SCHEME.length())
                || !Character.isWhitespace(trimmed.charAt(SCHEME.length()))) {
            return Optional.empty();
        }
        String token = trimmed.substring(SCHEME.length()).strip();
        if (token.isEmpty() || token.chars().anyMatch(Character::isWhitespace)) {
            return Optional.empty();
        }
        return Optional.of(token);
    }
}
