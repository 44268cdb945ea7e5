package com.tasknest.todoservice.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/** A fresh access token. The refresh token itself is not rotated. */
@Data
@Builder
public class RefreshTokenResponse {

    private String accessToken;
    @Builder.Default
    private String tokenType = "bearer";
    private long expiresIn;
    private Instant expiresAt;
}
