package com.tasknest.todoservice.support;

import com.tasknest.todoservice.service.TokenRevocationService;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/** Denylist with the same expiry behaviour as the Redis one, driven by a test clock. */
public class InMemoryRevocationService implements TokenRevocationService {

    private final Clock clock;
    private final Map<String, Instant> entries = new HashMap<>();
    private Duration lastTtl;

    public InMemoryRevocationService(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void revoke(String jti, Duration ttl) {
        lastTtl = ttl;
        entries.put(jti, clock.instant().plus(ttl));
    }

    @Override
    public boolean isRevoked(String jti) {
        Instant expiresAt = entries.get(jti);
        return expiresAt != null && clock.instant().isBefore(expiresAt);
    }

    public Duration lastTtl() {
        return lastTtl;
    }
}
