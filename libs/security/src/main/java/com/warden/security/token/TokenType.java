package com.warden.security.token;

import java.util.Optional;

public enum TokenType {
    ACCESS("access"),
    REFRESH("refresh");

    private final String claimValue;

    TokenType(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }

    public static Optional<TokenType> fromClaim(Object value) {
        for (TokenType type : values()) {
            if (type.claimValue.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
