package com.warden.security.token;

import io.jsonwebtoken.security.Keys;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;

/**
 * HMAC key used for HS256, identified by the {@code kid} header.
 *
 * @param id     key id written to and matched against the token header
 * @param secret shared secret, at least 32 bytes
 */
public record SigningKey(String id, SecretKey secret) {

    public static final int MIN_SECRET_BYTES = 32;

    public SigningKey {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("key id must not be blank");
        }
        if (secret == null) {
            throw new IllegalArgumentException("secret must not be null");
        }
    }

    /**
     * @throws IllegalArgumentException when the secret is shorter than {@value #MIN_SECRET_BYTES} bytes
     */
    public static SigningKey of(String id, String secret) {
        byte[] bytes = secret == null ? new byte[0] : secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < MIN_SECRET_BYTES) {
            throw new IllegalArgumentException("Signing secret for key '%s' must be at least %d bytes"
                    .formatted(id, MIN_SECRET_BYTES));
        }
        return new SigningKey(id, Keys.hmacShaKeyFor(bytes));
    }

    @Override
    public String toString() {
        return "SigningKey[id=" + id + "]";
    }
}
