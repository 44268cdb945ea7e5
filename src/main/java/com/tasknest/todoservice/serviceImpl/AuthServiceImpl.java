package com.tasknest.todoservice.serviceImpl;

import com.tasknest.todoservice.SecurityConfig.IssuedToken;
import com.tasknest.todoservice.SecurityConfig.JwtTokenProviderConfig;
import com.tasknest.todoservice.SecurityConfig.PasswordHasher;
import com.tasknest.todoservice.SecurityConfig.TokenClaims;
import com.tasknest.todoservice.SecurityConfig.TokenKind;
import com.tasknest.todoservice.SecurityConfig.TokenVerificationException;
import com.tasknest.todoservice.config.TokenProperties;
import com.tasknest.todoservice.dto.LoginRequest;
import com.tasknest.todoservice.dto.LoginResponse;
import com.tasknest.todoservice.dto.RefreshTokenResponse;
import com.tasknest.todoservice.dto.UserSummary;
import com.tasknest.todoservice.entity.User;
import com.tasknest.todoservice.exception.AuthExceptions;
import com.tasknest.todoservice.exception.UserExceptions;
import com.tasknest.todoservice.repository.UserRepository;
import com.tasknest.todoservice.service.AuthService;
import com.tasknest.todoservice.service.TokenRevocationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthServiceImpl implements AuthService {

    private static final Duration MIN_REVOCATION_TTL = Duration.ofSeconds(1);

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;
    private final JwtTokenProviderConfig jwtTokenProvider;
    private final TokenRevocationService revocationService;
    private final TokenProperties tokenProperties;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public User authenticate(String username, String password) {
        if (username == null || username.isBlank() || password == null) {
            passwordHasher.verifyAgainstDummy(password);
            throw new AuthExceptions.InvalidCredentials();
        }

        Optional<User> found = userRepository.findByUsername(username.trim());
        if (found.isEmpty()) {
            passwordHasher.verifyAgainstDummy(password);
            throw new AuthExceptions.InvalidCredentials();
        }

        User user = found.get();
        if (!passwordHasher.verify(password, user.getPassword())) {
            throw new AuthExceptions.InvalidCredentials();
        }
        return user;
    }

    @Override
    public IssuedToken issueAccessToken(User user) {
        Objects.requireNonNull(user, "user is required");
        return jwtTokenProvider.issue(user.getUsername(), TokenKind.ACCESS, tokenProperties.getAccessTtl());
    }

    @Override
    public IssuedToken issueRefreshToken(User user) {
        Objects.requireNonNull(user, "user is required");
        return jwtTokenProvider.issue(user.getUsername(), TokenKind.REFRESH, tokenProperties.getRefreshTtl());
    }

    @Override
    @Transactional(readOnly = true)
    public LoginResponse login(LoginRequest request) {
        User user = authenticate(request.getUsername(), request.getPassword());

        IssuedToken access = issueAccessToken(user);
        IssuedToken refresh = issueRefreshToken(user);

        log.info("Login success for username={}", user.getUsername());
        return LoginResponse.builder()
                .accessToken(access.token())
                .refreshToken(refresh.token())
                .expiresIn(secondsUntil(access.expiresAt()))
                .accessTokenExpiresAt(access.expiresAt())
                .refreshTokenExpiresAt(refresh.expiresAt())
                .issuedAt(Instant.now(clock))
                .user(UserSummary.from(user))
                .build();
    }

    @Override
    @Transactional(readOnly = true)
    public User resolveIdentity(String token, TokenKind expectedKind) {
        TokenClaims claims = verifyOrUnauthorized(token, expectedKind);

        if (mustCheckDenylist(expectedKind) && revocationService.isRevoked(claims.jti())) {
            log.debug("Rejected revoked {} token jti={}", expectedKind.claimValue(), claims.jti());
            throw new AuthExceptions.Unauthorized();
        }

        return userRepository.findByUsername(claims.subject())
                .orElseThrow(() -> new UserExceptions.UserNotFound(
                        "Account '" + claims.subject() + "' no longer exists."));
    }

    @Override
    @Transactional(readOnly = true)
    public RefreshTokenResponse refresh(String refreshToken) {
        User user = resolveIdentity(refreshToken, TokenKind.REFRESH);
        IssuedToken access = issueAccessToken(user);

        log.debug("Issued access token from refresh token for username={}", user.getUsername());
        return RefreshTokenResponse.builder()
                .accessToken(access.token())
                .expiresIn(secondsUntil(access.expiresAt()))
                .expiresAt(access.expiresAt())
                .build();
    }

    @Override
    public void logout(String accessToken, String refreshToken) {
        TokenClaims access = verifyOrUnauthorized(accessToken, TokenKind.ACCESS);

        TokenClaims refresh = null;
        if (refreshToken != null && !refreshToken.isBlank()) {
            if (tokenProperties.getRevocation().isCheckRefresh()) {
                refresh = verifyOrUnauthorized(refreshToken, TokenKind.REFRESH);
                if (!refresh.subject().equals(access.subject())) {
                    log.debug("Logout refresh token belongs to another subject");
                    throw new AuthExceptions.Unauthorized();
                }
            } else {
                log.debug("Refresh revocation disabled; leaving refresh token untouched");
            }
        }

        revocationService.revoke(access.jti(), remainingLifetime(access));
        if (refresh != null) {
            revocationService.revoke(refresh.jti(), remainingLifetime(refresh));
        }
        log.info("Logout for username={} (jti={}, refreshRevoked={})",
                access.subject(), access.jti(), refresh != null);
    }

    // -------------------- helpers --------------------

    private TokenClaims verifyOrUnauthorized(String token, TokenKind expectedKind) {
        try {
            return jwtTokenProvider.verify(token, expectedKind);
        } catch (TokenVerificationException e) {
            log.debug("Token rejected ({}): {}", e.getReason(), e.getMessage());
            throw new AuthExceptions.Unauthorized();
        }
    }

    /**
     * How long a denylist entry must live: until the parser would reject the token
     * on its own, which is exp plus the tolerated skew.
     */
    private Duration remainingLifetime(TokenClaims claims) {
        Duration left = Duration.between(Instant.now(clock), claims.expiresAt());
        if (left.isNegative()) {
            left = Duration.ZERO;
        }
        Duration skew = tokenProperties.getClockSkew();
        if (skew != null && !skew.isNegative()) {
            left = left.plus(skew);
        }
        return left.compareTo(MIN_REVOCATION_TTL) < 0 ? MIN_REVOCATION_TTL : left;
    }

    private boolean mustCheckDenylist(TokenKind kind) {
        return kind == TokenKind.ACCESS || tokenProperties.getRevocation().isCheckRefresh();
    }

    private long secondsUntil(Instant instant) {
        return Math.max(0, Duration.between(Instant.now(clock), instant).getSeconds());
    }
}
