package com.warden.security;

/**
 * Authentication failed. The message never reveals which factor was wrong: unknown email,
 * wrong password, wrong tenant, locked account and tampered tokens all look the same.
 */
public class InvalidCredentialsException extends RuntimeException {

    public static final String GENERIC_MESSAGE = "Invalid credentials";

    public InvalidCredentialsException() {
        super(GENERIC_MESSAGE);
    }

    public InvalidCredentialsException(Throwable cause) {
        super(GENERIC_MESSAGE, cause);
    }
}
