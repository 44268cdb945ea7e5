package com.tasknest.todoservice.SecurityConfig;

import java.time.Instant;

public record IssuedToken(String token, String jti, Instant expiresAt) {
}
