package com.tasknest.todoservice.SecurityConfig;

import com.tasknest.todoservice.entity.User;
import com.tasknest.todoservice.exception.ApiException;
import com.tasknest.todoservice.exception.AuthExceptions;
import com.tasknest.todoservice.exception.UserExceptions;
import com.tasknest.todoservice.service.AuthService;
import com.tasknest.todoservice.utils.ErrorResponseWriter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Resolves the bearer access token into an authenticated {@link User}.
 * A rejected token leaves the request anonymous; the entry point then answers 401
 * for protected paths.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtAuthFilterConfig extends OncePerRequestFilter {

    static final String BEARER_PREFIX = "Bearer ";

    private final AuthService authService;
    private final ErrorResponseWriter errorResponseWriter;

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {

        final String token = bearerToken(request);
        if (token == null || SecurityContextHolder.getContext().getAuthentication() != null) {
            filterChain.doFilter(request, response);
            return;
        }

        try {
            User user = authService.resolveIdentity(token, TokenKind.ACCESS);

            SecurityContext securityContext = SecurityContextHolder.createEmptyContext();
            UsernamePasswordAuthenticationToken authToken =
                    new UsernamePasswordAuthenticationToken(user, null, user.getAuthorities());
            authToken.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
            securityContext.setAuthentication(authToken);
            SecurityContextHolder.setContext(securityContext);
        } catch (AuthExceptions.Unauthorized | UserExceptions.UserNotFound ex) {
            log.debug("Bearer token not accepted for {}: {}", request.getRequestURI(), ex.getMessage());
        } catch (ApiException ex) {
            // e.g. denylist unreachable: fail the request rather than let it through anonymously
            errorResponseWriter.write(request, response, ex.getStatus(), ex.getType(), ex.getTitle(), ex.getMessage());
            return;
        }

        filterChain.doFilter(request, response);
    }

    public static String bearerToken(HttpServletRequest request) {
        final String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (!StringUtils.hasText(authHeader) || !authHeader.startsWith(BEARER_PREFIX)) {
            return null;
        }
        String token = authHeader.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
