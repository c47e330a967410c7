package com.warden.security.auth;

import com.warden.security.session.RequestContext;

/**
 * @param mfaCode    TOTP, SMS or EMAIL code, or a backup code; null on the first attempt
 * @param rememberMe request the long session lifetime
 * @param context    client address and user agent, recorded on the session
 */
public record LoginRequest(String email, String password, String mfaCode, boolean rememberMe, RequestContext context) {

    public LoginRequest {
        if (context == null) {
            context = RequestContext.unknown();
        }
    }

    public static LoginRequest of(String email, String password) {
        return new LoginRequest(email, password, null, false, RequestContext.unknown());
    }

    public LoginRequest withMfaCode(String code) {
        return new LoginRequest(email, password, code, rememberMe, context);
    }

    @Override
    public String toString() {
        return "LoginRequest[email=" + email + ", rememberMe=" + rememberMe + "]";
    }
}
