package com.tasknest.todoservice.SecurityConfig;

import com.tasknest.todoservice.exception.ExternalExceptions;
import com.tasknest.todoservice.service.TokenRevocationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Redis-backed denylist. Presence of {@code jwt:bl:jti:<jti>} means revoked;
 * Redis drops the key when its TTL runs out, so nothing here sweeps.
 * <p>
 * Fails closed: if Redis cannot be reached the request fails with 503
 * rather than accepting a possibly revoked token.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenBlacklistConfig implements TokenRevocationService {

    static final String KEY_PREFIX = "jwt:bl:jti:";   // blacklist namespace
    private static final long MIN_TTL_MS = 100L;      // clamp very short TTLs

    private final StringRedisTemplate redis;

    @Override
    public void revoke(String jti, Duration ttl) {
        requireJti(jti);
        Objects.requireNonNull(ttl, "ttl is required");
        long ttlMs = Math.max(ttl.toMillis(), MIN_TTL_MS);
        try {
            // Presence is what matters; value is tiny
            redis.opsForValue().set(key(jti), "1", ttlMs, TimeUnit.MILLISECONDS);
        } catch (DataAccessException dae) {
            log.error("Redis unavailable while revoking token", dae);
            throw new ExternalExceptions.UpstreamUnavailable("Token revocation store is unavailable.");
        }
    }

    @Override
    public boolean isRevoked(String jti) {
        requireJti(jti);
        try {
            return Boolean.TRUE.equals(redis.hasKey(key(jti)));
        } catch (DataAccessException dae) {
            log.error("Redis unavailable during revocation check", dae);
            throw new ExternalExceptions.UpstreamUnavailable("Token revocation store is unavailable.");
        }
    }

    private static String key(String jti) {
        return KEY_PREFIX + jti;
    }

    private static void requireJti(String jti) {
        if (jti == null || jti.isBlank()) {
            throw new IllegalArgumentException("jti is required");
        }
    }
}
