package com.warden.security.password;

public class PasswordHashingException extends RuntimeException {

    public PasswordHashingException(String message, Throwable cause) {
        super(message, cause);
    }
}
