package com.warden.security.token;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.security.InvalidCredentialsException;
import com.warden.security.Role;
import com.warden.security.TokenExpiredException;
import com.warden.security.session.Session;
import com.warden.security.user.User;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwsHeader;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.SigningKeyResolverAdapter;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.jackson.io.JacksonDeserializer;
import io.jsonwebtoken.jackson.io.JacksonSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.Key;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * Issues and verifies HS256 access and refresh tokens.
 * <p>
 * Both tokens of a pair are bound to one session. The access token expires after the configured
 * TTL (never after its session); the refresh token expires with the session. The signing key is
 * looked up by the {@code kid} header, so tokens signed with a retired key keep verifying as long
 * as the {@link SigningKeyStore} still holds it.
 * <p>
 * Verification failures are reported as {@link TokenExpiredException} when only the expiry is
 * wrong, and as {@link InvalidCredentialsException} for everything else.
 */
public class TokenService {

    private static final Logger log = LoggerFactory.getLogger(TokenService.class);

    static final String CLAIM_USER_ID = "user_id";
    static final String CLAIM_TENANT_ID = "tenant_id";
    static final String CLAIM_SESSION_ID = "session_id";
    static final String CLAIM_ROLE = "role";
    static final String CLAIM_PERMISSIONS = "perms";
    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_TYPE = "type";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SigningKeyStore keys;
    private final TokenSettings settings;
    private final Clock clock;
    private final JwtParser parser;

    public TokenService(SigningKeyStore keys, TokenSettings settings, Clock clock) {
        this.keys = keys;
        this.settings = settings;
        this.clock = clock;
        this.parser = Jwts.parserBuilder()
                .deserializeJsonWith(new JacksonDeserializer<>(MAPPER))
                .setSigningKeyResolver(new KeyIdResolver())
                .requireIssuer(settings.issuer())
                .setClock(() -> Date.from(clock.instant()))
                .build();
    }

    public TokenSettings settings() {
        return settings;
    }

    /**
     * Issues a fresh pair for a user's new session.
     */
    public TokenPair issue(User user, Session session) {
        if (!user.getId().equals(session.userId()) || !user.getTenantId().equals(session.tenantId())) {
            throw new IllegalArgumentException("Session does not belong to user");
        }
        Instant now = clock.instant();
        TokenClaims base = new TokenClaims(
                user.getId(),
                user.getTenantId(),
                session.id(),
                user.getRole(),
                user.effectivePermissions(),
                user.getEmail(),
                TokenType.ACCESS,
                null,
                now,
                session.expiresAt());
        return issuePair(base, now, session.expiresAt());
    }

    /**
     * Reissues both tokens from a valid refresh token. Role, permissions and email come from
     * {@code user} as it is now, so a changed role takes effect on the next refresh. The tenant is
     * the one in the token and the new refresh token keeps the old expiry.
     *
     * @param user    the token's user, freshly loaded
     * @param session the token's session, still active
     * @throws TokenExpiredException        when the refresh token expired
     * @throws InvalidCredentialsException  for any other invalid token, including access tokens, or
     *                                      when {@code user} or {@code session} is not the token's
     */
    public TokenPair refresh(String refreshToken, User user, Session session) {
        TokenClaims claims = verifyRefresh(refreshToken);
        if (!claims.userId().equals(user.getId())
                || !claims.tenantId().equals(user.getTenantId())
                || !claims.sessionId().equals(session.id())
                || !claims.tenantId().equals(session.tenantId())) {
            log.debug("Refresh token of session {} presented with another user or session", claims.sessionId());
            throw new InvalidCredentialsException();
        }
        Instant now = clock.instant();
        TokenClaims base = new TokenClaims(
                claims.userId(),
                claims.tenantId(),
                claims.sessionId(),
                user.getRole(),
                user.effectivePermissions(),
                user.getEmail(),
                TokenType.ACCESS,
                null,
                now,
                claims.expiresAt());
        return issuePair(base, now, claims.expiresAt());
    }

    public TokenClaims verify(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidCredentialsException();
        }
        Claims body;
        try {
            body = parser.parseClaimsJws(token).getBody();
        } catch (ExpiredJwtException e) {
            throw new TokenExpiredException(e);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected token: {}", e.getMessage());
            throw new InvalidCredentialsException(e);
        }
        try {
            return toClaims(body);
        } catch (IllegalArgumentException | ClassCastException | NullPointerException e) {
            log.debug("Token claims are malformed: {}", e.getMessage());
            throw new InvalidCredentialsException(e);
        }
    }

    public TokenClaims verifyAccess(String token) {
        return requireType(verify(token), TokenType.ACCESS);
    }

    public TokenClaims verifyRefresh(String token) {
        return requireType(verify(token), TokenType.REFRESH);
    }

    private TokenPair issuePair(TokenClaims base, Instant now, Instant refreshExpiresAt) {
        Instant accessExpiresAt = now.plus(settings.accessTokenTtl());
        if (accessExpiresAt.isAfter(refreshExpiresAt)) {
            accessExpiresAt = refreshExpiresAt;
        }
        String access = sign(base, TokenType.ACCESS, now, accessExpiresAt);
        String refresh = sign(base, TokenType.REFRESH, now, refreshExpiresAt);
        long expiresIn = Math.max(0, accessExpiresAt.getEpochSecond() - now.getEpochSecond());
        return new TokenPair(access, refresh, expiresIn);
    }

    private String sign(TokenClaims claims, TokenType type, Instant issuedAt, Instant expiresAt) {
        SigningKey key = keys.current();
        var builder = Jwts.builder()
                .serializeToJsonWith(new JacksonSerializer<>(MAPPER))
                .setHeaderParam(JwsHeader.KEY_ID, key.id())
                .setId(UUID.randomUUID().toString())
                .setIssuer(settings.issuer())
                .setSubject(claims.userId().toString())
                .setIssuedAt(Date.from(issuedAt))
                .setExpiration(Date.from(expiresAt))
                .claim(CLAIM_USER_ID, claims.userId().toString())
                .claim(CLAIM_TENANT_ID, claims.tenantId().toString())
                .claim(CLAIM_SESSION_ID, claims.sessionId().toString())
                .claim(CLAIM_ROLE, claims.role().value())
                .claim(CLAIM_PERMISSIONS, PermissionCodec.encode(claims.permissions()))
                .claim(CLAIM_TYPE, type.claimValue());
        if (type == TokenType.ACCESS && claims.email() != null) {
            builder.claim(CLAIM_EMAIL, claims.email());
        }
        return builder.signWith(key.secret(), SignatureAlgorithm.HS256).compact();
    }

    private static TokenClaims toClaims(Claims body) {
        UUID userId = UUID.fromString(body.getSubject());
        if (!userId.toString().equals(body.get(CLAIM_USER_ID, String.class))) {
            throw new IllegalArgumentException("subject and user_id differ");
        }
        Role role = Role.fromString(body.get(CLAIM_ROLE, String.class))
                .orElseThrow(() -> new IllegalArgumentException("unknown role"));
        TokenType type = TokenType.fromClaim(body.get(CLAIM_TYPE))
                .orElseThrow(() -> new IllegalArgumentException("unknown token type"));
        return new TokenClaims(
                userId,
                UUID.fromString(body.get(CLAIM_TENANT_ID, String.class)),
                UUID.fromString(body.get(CLAIM_SESSION_ID, String.class)),
                role,
                PermissionCodec.decode(body.get(CLAIM_PERMISSIONS, String.class)),
                body.get(CLAIM_EMAIL, String.class),
                type,
                body.getId(),
                body.getIssuedAt().toInstant(),
                body.getExpiration().toInstant());
    }

    private static TokenClaims requireType(TokenClaims claims, TokenType expected) {
        if (claims.type() != expected) {
            log.debug("Expected {} token but got {}", expected, claims.type());
            throw new InvalidCredentialsException();
        }
        return claims;
    }

    private final class KeyIdResolver extends SigningKeyResolverAdapter {

        @Override
        public Key resolveSigningKey(JwsHeader header, Claims claims) {
            return keys.find(header.getKeyId())
                    .map(SigningKey::secret)
                    .orElseThrow(() -> new UnsupportedJwtException("Unknown signing key id: " + header.getKeyId()));
        }
    }
}
