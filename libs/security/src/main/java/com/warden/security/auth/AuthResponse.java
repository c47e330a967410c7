package com.warden.security.auth;

import com.warden.security.mfa.MfaMethod;
import com.warden.security.token.TokenPair;
import com.warden.security.user.UserProfile;

import java.util.List;
import java.util.UUID;

/**
 * Result of a login attempt that did not fail outright.
 * <p>
 * Either {@code success} is true and tokens are present, or {@code mfaRequired} is true and the
 * client must repeat the login, password included, with a code for one of {@code mfaMethods}.
 */
public record AuthResponse(
        boolean success,
        TokenPair tokens,
        UserProfile user,
        UUID sessionId,
        boolean mfaRequired,
        List<MfaMethod> mfaMethods,
        boolean passwordChangeRequired
) {

    public AuthResponse {
        mfaMethods = mfaMethods == null ? List.of() : List.copyOf(mfaMethods);
    }

    public static AuthResponse authenticated(TokenPair tokens, UserProfile user, UUID sessionId,
                                             boolean passwordChangeRequired) {
        return new AuthResponse(true, tokens, user, sessionId, false, List.of(), passwordChangeRequired);
    }

    public static AuthResponse mfaChallenge(List<MfaMethod> methods) {
        return new AuthResponse(false, null, null, null, true, methods, false);
    }
}
