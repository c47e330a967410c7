package com.warden.security.user;

public enum UserStatus {
    ACTIVE,
    INACTIVE,
    SUSPENDED,
    PENDING_ACTIVATION,
    PENDING_PASSWORD_RESET
}
