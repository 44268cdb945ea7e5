package com.tasknest.todoservice.SecurityConfig;

import com.tasknest.todoservice.utils.ErrorResponseWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Sends 401 for unauthenticated requests to protected paths.
 * Adds the RFC 6750 invalid_token hint only when a Bearer token was presented.
 */
@Slf4j
@Component
public class JwtAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ErrorResponseWriter writer;

    public JwtAuthenticationEntryPoint(ErrorResponseWriter writer) {
        this.writer = writer;
    }

    @Override
    public void commence(@NonNull HttpServletRequest request,
                         @NonNull HttpServletResponse response,
                         @NonNull AuthenticationException authException) throws IOException {
        String ah = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (ah != null && ah.startsWith(JwtAuthFilterConfig.BEARER_PREFIX)) {
            response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer error=\"invalid_token\"");
        } else {
            response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        }

        writer.write(
                request,
                response,
                HttpStatus.UNAUTHORIZED,
                "https://tasknest.dev/problems/unauthorized",
                "Unauthorized",
                "Could not validate credentials: please provide a valid token."
        );
    }
}
