package com.warden.security;

/**
 * The caller is authenticated but lacks the role or permission an operation requires.
 */
public class InsufficientPermissionsException extends RuntimeException {

    public InsufficientPermissionsException(String message) {
        super(message);
    }
}
