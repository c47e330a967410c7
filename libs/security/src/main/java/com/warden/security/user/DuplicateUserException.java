package com.warden.security.user;

/**
 * The email is already registered in the tenant.
 */
public class DuplicateUserException extends RuntimeException {

    public DuplicateUserException(String message) {
        super(message);
    }
}
