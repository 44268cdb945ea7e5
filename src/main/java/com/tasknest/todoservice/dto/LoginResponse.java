package com.tasknest.todoservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LoginResponse {

    private String accessToken;
    private String refreshToken;
    @Builder.Default
    private String tokenType = "bearer";
    /** Seconds until the access token expires. */
    private long expiresIn;
    private Instant accessTokenExpiresAt;
    private Instant refreshTokenExpiresAt;
    private Instant issuedAt;
    private UserSummary user;
}
