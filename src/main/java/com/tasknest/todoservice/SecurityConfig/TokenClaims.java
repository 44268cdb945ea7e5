package com.tasknest.todoservice.SecurityConfig;

import java.time.Instant;

/** Verified contents of a session token. */
public record TokenClaims(
        String subject,
        TokenKind kind,
        String jti,
        Instant issuedAt,
        Instant expiresAt
) {
}
