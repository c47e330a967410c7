package com.warden.security.audit;

import java.util.Locale;

public enum AuditEventType {
    USER_CREATED,
    USER_REGISTERED,
    USER_UPDATED,
    LOGIN_SUCCESS,
    LOGIN_FAILED,
    MFA_FAILED,
    ACCOUNT_LOCKED,
    LOGOUT,
    TOKEN_REFRESHED,
    PASSWORD_CHANGED,
    PASSWORD_RESET_REQUESTED,
    PASSWORD_RESET,
    EMAIL_VERIFIED,
    MFA_SETUP,
    MFA_ENABLED,
    MFA_DISABLED,
    SESSION_REVOKED;

    /**
     * Snake-case name, e.g. {@code login_success}.
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
