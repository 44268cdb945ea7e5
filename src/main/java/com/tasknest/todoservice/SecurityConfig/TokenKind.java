package com.tasknest.todoservice.SecurityConfig;

import java.util.Arrays;
import java.util.Optional;

/**
 * Session token family. Carried in the signed "kind" claim so an endpoint
 * expecting one kind rejects the other.
 */
public enum TokenKind {

    ACCESS("access"),
    REFRESH("refresh");

    private final String claimValue;

    TokenKind(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }

    public static Optional<TokenKind> fromClaim(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(k -> k.claimValue.equals(value))
                .findFirst();
    }
}
