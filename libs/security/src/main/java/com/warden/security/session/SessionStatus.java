package com.warden.security.session;

public enum SessionStatus {
    ACTIVE,
    EXPIRED,
    REVOKED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
