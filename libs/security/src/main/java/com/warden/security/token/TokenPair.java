package com.warden.security.token;

/**
 * @param expiresIn access token lifetime in seconds
 */
public record TokenPair(String accessToken, String refreshToken, String tokenType, long expiresIn) {

    public static final String BEARER = "Bearer";

    public TokenPair(String accessToken, String refreshToken, long expiresIn) {
        this(accessToken, refreshToken, BEARER, expiresIn);
    }
}
