package com.warden.security.mfa;

/**
 * MFA enrollment could not be completed, for example because the QR code failed to render.
 */
public class MfaException extends RuntimeException {

    public MfaException(String message, Throwable cause) {
        super(message, cause);
    }
}
