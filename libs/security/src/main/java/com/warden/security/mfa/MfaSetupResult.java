package com.warden.security.mfa;

import java.util.List;

/**
 * What the user needs to finish enrolling: for TOTP the secret and a QR code, for every method
 * the one-time backup codes. Backup codes are only ever shown here.
 *
 * @param method          enrolled method
 * @param secret          base32 TOTP secret, null for SMS and EMAIL
 * @param provisioningUri {@code otpauth://} URI, null for SMS and EMAIL
 * @param qrCode          PNG data URI of the provisioning URI, null for SMS and EMAIL
 * @param backupCodes     plain backup codes
 */
public record MfaSetupResult(
        MfaMethod method,
        String secret,
        String provisioningUri,
        String qrCode,
        List<String> backupCodes
) {

    public MfaSetupResult {
        if (method == null) {
            throw new IllegalArgumentException("method must not be null");
        }
        backupCodes = backupCodes == null ? List.of() : List.copyOf(backupCodes);
    }
}
