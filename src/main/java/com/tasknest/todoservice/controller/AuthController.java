package com.tasknest.todoservice.controller;

import com.tasknest.todoservice.SecurityConfig.JwtAuthFilterConfig;
import com.tasknest.todoservice.dto.*;
import com.tasknest.todoservice.exception.AuthExceptions;
import com.tasknest.todoservice.service.AuthService;
import com.tasknest.todoservice.service.PasswordResetService;
import com.tasknest.todoservice.service.RegistrationService;
import com.tasknest.todoservice.utils.ResponseMessage;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
@Tag(name = "auth", description = "Registration, sessions and out-of-band links")
public class AuthController {

    private final AuthService authService;
    private final RegistrationService registrationService;
    private final PasswordResetService passwordResetService;

    @PostMapping("/register")
    @ResponseMessage("User created successfully")
    @Operation(summary = "Create an unverified account and mail its verification link")
    public ResponseEntity<UserSummary> register(@Valid @RequestBody RegistrationRequest request) {
        UserSummary created = registrationService.register(request);

        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.LOCATION, "/users/me");
        return new ResponseEntity<>(created, headers, HttpStatus.CREATED);
    }

    @PostMapping(value = "/login", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Exchange username and password for an access and a refresh token")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    /** Same as /login, for OAuth2 password-grant style clients posting a form. */
    @PostMapping(value = "/token", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    @Operation(summary = "Form-encoded login")
    public ResponseEntity<LoginResponse> token(@Valid @ModelAttribute LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    @PostMapping("/refresh")
    @Operation(summary = "Mint a new access token from a refresh token")
    public ResponseEntity<RefreshTokenResponse> refresh(@Valid @RequestBody RefreshTokenRequest request) {
        return ResponseEntity.ok(authService.refresh(request.getRefreshToken()));
    }

    @PostMapping("/logout")
    @Operation(summary = "Revoke the presented access token, and the refresh token when refresh revocation is on")
    public ResponseEntity<MessageResponse> logout(HttpServletRequest request,
                                                  @RequestBody(required = false) LogoutRequest body) {
        String token = JwtAuthFilterConfig.bearerToken(request);
        if (token == null) {
            throw new AuthExceptions.Unauthorized();
        }
        authService.logout(token, body != null ? body.getRefreshToken() : null);
        return ResponseEntity.ok(new MessageResponse("Logged out"));
    }

    @GetMapping("/verify/{token}")
    @Operation(summary = "Confirm the email address named by a verification link")
    public ResponseEntity<MessageResponse> verifyEmail(@PathVariable("token") String token) {
        registrationService.verifyEmail(token);
        return ResponseEntity.ok(new MessageResponse("Email verified"));
    }

    @PostMapping("/password-reset")
    @Operation(summary = "Mail a password reset link; answers 200 for any address")
    public ResponseEntity<MessageResponse> requestPasswordReset(@Valid @RequestBody PasswordResetRequest request) {
        passwordResetService.requestReset(request.getEmail());
        return ResponseEntity.ok(new MessageResponse(
                "If an account uses this address, a reset link has been sent."));
    }

    @PostMapping("/password-reset/{token}")
    @Operation(summary = "Set a new password using a reset link")
    public ResponseEntity<MessageResponse> resetPassword(@PathVariable("token") String token,
                                                         @Valid @RequestBody ResetPasswordRequest request) {
        passwordResetService.resetPassword(token, request.getPassword(), request.getConfirmPassword());
        return ResponseEntity.ok(new MessageResponse("Password updated"));
    }
}
