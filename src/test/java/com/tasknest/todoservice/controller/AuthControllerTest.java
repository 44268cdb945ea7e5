package com.tasknest.todoservice.controller;

import com.tasknest.todoservice.dto.LoginResponse;
import com.tasknest.todoservice.dto.RefreshTokenResponse;
import com.tasknest.todoservice.dto.UserSummary;
import com.tasknest.todoservice.exception.AuthExceptions;
import com.tasknest.todoservice.exception.GlobalExceptionHandler;
import com.tasknest.todoservice.exception.ResourceExceptions;
import com.tasknest.todoservice.exception.UserExceptions;
import com.tasknest.todoservice.service.AuthService;
import com.tasknest.todoservice.service.PasswordResetService;
import com.tasknest.todoservice.service.RegistrationService;
import com.tasknest.todoservice.utils.ErrorResponseWriter;
import com.tasknest.todoservice.utils.SuccessEnvelopeAdvice;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class AuthControllerTest {

    @Mock
    private AuthService authService;

    @Mock
    private RegistrationService registrationService;

    @Mock
    private PasswordResetService passwordResetService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ErrorResponseWriter writer = new ErrorResponseWriter(Jackson2ObjectMapperBuilder.json().build());
        mockMvc = MockMvcBuilders
                .standaloneSetup(new AuthController(authService, registrationService, passwordResetService))
                .setControllerAdvice(new GlobalExceptionHandler(writer), new SuccessEnvelopeAdvice())
                .build();
    }

    private static LoginResponse loginResponse() {
        return LoginResponse.builder()
                .accessToken("access.jwt")
                .refreshToken("refresh.jwt")
                .expiresIn(3600)
                .issuedAt(Instant.parse("2026-01-05T09:00:00Z"))
                .build();
    }

    @Nested
    @DisplayName("POST /auth/register")
    class Register {

        @Test
        @DisplayName("201 with the account summary in the envelope")
        void created() throws Exception {
            when(registrationService.register(any())).thenReturn(UserSummary.builder()
                    .id("8b0f")
                    .username("alice")
                    .email("alice@x.com")
                    .role("ROLE_USER")
                    .build());

            mockMvc.perform(post("/auth/register")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"username\":\"alice\",\"email\":\"alice@x.com\",\"password\":\"p4ssword1\"}"))
                    .andExpect(status().isCreated())
                    .andExpect(header().string("Location", "/users/me"))
                    .andExpect(jsonPath("$.message").value("User created successfully"))
                    .andExpect(jsonPath("$.data.username").value("alice"))
                    .andExpect(jsonPath("$.data.password").doesNotExist());
        }

        @Test
        @DisplayName("409 for a taken username")
        void conflict() throws Exception {
            when(registrationService.register(any())).thenThrow(new UserExceptions.UsernameTaken("alice"));

            mockMvc.perform(post("/auth/register")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"username\":\"alice\",\"email\":\"alice@x.com\",\"password\":\"p4ssword1\"}"))
                    .andExpect(status().isConflict())
                    .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_PROBLEM_JSON))
                    .andExpect(jsonPath("$.title").value("Username already registered"));
        }

        @Test
        @DisplayName("422 when required fields are missing")
        void missingFields() throws Exception {
            mockMvc.perform(post("/auth/register")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"email\":\"not-an-email\"}"))
                    .andExpect(status().isUnprocessableEntity());
            verifyNoInteractions(registrationService);
        }
    }

    @Nested
    @DisplayName("login")
    class Login {

        @Test
        @DisplayName("JSON login returns both tokens")
        void json() throws Exception {
            when(authService.login(any())).thenReturn(loginResponse());

            mockMvc.perform(post("/auth/login")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"username\":\"alice\",\"password\":\"p4ssword1\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.accessToken").value("access.jwt"))
                    .andExpect(jsonPath("$.data.refreshToken").value("refresh.jwt"))
                    .andExpect(jsonPath("$.data.tokenType").value("bearer"));
        }

        @Test
        @DisplayName("form login binds username and password")
        void form() throws Exception {
            when(authService.login(any())).thenReturn(loginResponse());

            mockMvc.perform(post("/auth/token")
                            .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                            .param("username", "alice")
                            .param("password", "p4ssword1"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.accessToken").value("access.jwt"));

            verify(authService).login(argThat(r -> "alice".equals(r.getUsername()) && "p4ssword1".equals(r.getPassword())));
        }

        @Test
        @DisplayName("bad credentials are a 401 with a Bearer challenge")
        void badCredentials() throws Exception {
            when(authService.login(any())).thenThrow(new AuthExceptions.InvalidCredentials());

            mockMvc.perform(post("/auth/login")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"username\":\"alice\",\"password\":\"nope\"}"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(header().string("WWW-Authenticate", "Bearer"))
                    .andExpect(jsonPath("$.detail").value("Incorrect username or password."));
        }
    }

    @Nested
    @DisplayName("refresh and logout")
    class Session {

        @Test
        @DisplayName("refresh returns a new access token")
        void refresh() throws Exception {
            when(authService.refresh("refresh.jwt")).thenReturn(RefreshTokenResponse.builder()
                    .accessToken("new.access.jwt")
                    .expiresIn(3600)
                    .build());

            mockMvc.perform(post("/auth/refresh")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"refreshToken\":\"refresh.jwt\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.accessToken").value("new.access.jwt"));
        }

        @Test
        @DisplayName("refresh with an invalid token is a 401")
        void refreshRejected() throws Exception {
            when(authService.refresh("stale")).thenThrow(new AuthExceptions.Unauthorized());

            mockMvc.perform(post("/auth/refresh")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"refreshToken\":\"stale\"}"))
                    .andExpect(status().isUnauthorized());
        }

        @Test
        @DisplayName("logout revokes the bearer token")
        void logout() throws Exception {
            mockMvc.perform(post("/auth/logout").header("Authorization", "Bearer access.jwt"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.message").value("Logged out"));

            verify(authService).logout("access.jwt", null);
        }

        @Test
        @DisplayName("logout passes an optional refresh token along")
        void logoutWithRefreshToken() throws Exception {
            mockMvc.perform(post("/auth/logout")
                            .header("Authorization", "Bearer access.jwt")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"refreshToken\":\"refresh.jwt\"}"))
                    .andExpect(status().isOk());

            verify(authService).logout("access.jwt", "refresh.jwt");
        }

        @Test
        @DisplayName("logout without a bearer token is a 401")
        void logoutWithoutToken() throws Exception {
            mockMvc.perform(post("/auth/logout"))
                    .andExpect(status().isUnauthorized());

            verifyNoInteractions(authService);
        }
    }

    @Nested
    @DisplayName("links")
    class Links {

        @Test
        @DisplayName("a valid verification link is a 200")
        void verifyLink() throws Exception {
            mockMvc.perform(get("/auth/verify/link.jwt"))
                    .andExpect(status().isOk());

            verify(registrationService).verifyEmail("link.jwt");
        }

        @Test
        @DisplayName("an unknown verification link is a 404")
        void verifyUnknown() throws Exception {
            doThrow(new ResourceExceptions.NotFound("Verification link is invalid or has expired."))
                    .when(registrationService).verifyEmail("bogus");

            mockMvc.perform(get("/auth/verify/bogus"))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("a reset request answers 200 whatever the address")
        void requestReset() throws Exception {
            mockMvc.perform(post("/auth/password-reset")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"email\":\"nobody@x.com\"}"))
                    .andExpect(status().isOk());

            verify(passwordResetService).requestReset("nobody@x.com");
        }

        @Test
        @DisplayName("mismatched passwords are a 422 before the service is called")
        void resetMismatch() throws Exception {
            mockMvc.perform(post("/auth/password-reset/link.jwt")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"password\":\"n3wpassword\",\"confirmPassword\":\"other1234\"}"))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.detail").value(containsString("confirmPassword")));

            verifyNoInteractions(passwordResetService);
        }

        @Test
        @DisplayName("a matching reset is passed through")
        void reset() throws Exception {
            mockMvc.perform(post("/auth/password-reset/link.jwt")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"password\":\"n3wpassword\",\"confirmPassword\":\"n3wpassword\"}"))
                    .andExpect(status().isOk());

            verify(passwordResetService).resetPassword("link.jwt", "n3wpassword", "n3wpassword");
        }
    }
}
