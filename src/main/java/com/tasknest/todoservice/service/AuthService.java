package com.tasknest.todoservice.service;

import com.tasknest.todoservice.SecurityConfig.IssuedToken;
import com.tasknest.todoservice.SecurityConfig.TokenKind;
import com.tasknest.todoservice.dto.LoginRequest;
import com.tasknest.todoservice.dto.LoginResponse;
import com.tasknest.todoservice.dto.RefreshTokenResponse;
import com.tasknest.todoservice.entity.User;

/**
 * Session lifecycle: credential check, token issuance, renewal, logout and
 * identity resolution from a bearer token.
 * <p>
 * Token failures of any kind leave this service as
 * {@link com.tasknest.todoservice.exception.AuthExceptions.Unauthorized}.
 */
public interface AuthService {

    /**
     * @throws com.tasknest.todoservice.exception.AuthExceptions.InvalidCredentials
     *         for an unknown username and for a wrong password alike
     */
    User authenticate(String username, String password);

    IssuedToken issueAccessToken(User user);

    IssuedToken issueRefreshToken(User user);

    LoginResponse login(LoginRequest request);

    /**
     * Verify {@code token} as {@code expectedKind}, check the denylist and load the account.
     *
     * @throws com.tasknest.todoservice.exception.AuthExceptions.Unauthorized     token invalid, expired, revoked or of the wrong kind
     * @throws com.tasknest.todoservice.exception.UserExceptions.UserNotFound     account deleted after issuance
     */
    User resolveIdentity(String token, TokenKind expectedKind);

    /** New access token for the refresh token's subject. The refresh token stays usable. */
    RefreshTokenResponse refresh(String refreshToken);

    /**
     * Denylist the access token's jti until it could no longer verify anyway.
     * When refresh revocation is switched on, a presented refresh token of the
     * same subject is denylisted too; otherwise it is ignored.
     *
     * @param refreshToken optional, may be {@code null}
     */
    void logout(String accessToken, String refreshToken);
}
