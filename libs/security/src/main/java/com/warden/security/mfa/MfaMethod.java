package com.warden.security.mfa;

import java.util.Locale;
import java.util.Optional;

public enum MfaMethod {
    TOTP,
    SMS,
    EMAIL;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<MfaMethod> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (MfaMethod method : values()) {
            if (method.name().equalsIgnoreCase(value.strip())) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }
}
