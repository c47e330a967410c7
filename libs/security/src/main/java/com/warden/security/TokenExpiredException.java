package com.warden.security;

/**
 * The token's signature is valid but its {@code exp} has passed. Unlike credential failures,
 * this is safe to disclose to the client.
 */
public class TokenExpiredException extends RuntimeException {

    public TokenExpiredException() {
        super("Token has expired");
    }

    public TokenExpiredException(Throwable cause) {
        super("Token has expired", cause);
    }
}
