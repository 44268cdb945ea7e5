package com.tasknest.todoservice.support;

import com.tasknest.todoservice.config.TokenProperties;

import java.time.Duration;
import java.time.Instant;

public final class TokenFixtures {

    /** 50 random-looking bytes, Base64. */
    public static final String SECRET = "ZGV2LW9ubHktc2lnbmluZy1zZWNyZXQtY2hhbmdlLW1lLWJlZm9yZS1kZXBsb3lpbmc=";
    public static final String OTHER_SECRET = "YW5vdGhlci1jb21wbGV0ZWx5LWRpZmZlcmVudC1zaWduaW5nLXNlY3JldCEh";

    public static final Instant T0 = Instant.parse("2026-01-05T09:00:00Z");

    private TokenFixtures() {}

    /** Default lifetimes, no clock skew so expiry lands exactly on exp. */
    public static TokenProperties properties() {
        return properties(SECRET);
    }

    public static TokenProperties properties(String secret) {
        TokenProperties props = new TokenProperties();
        props.getKey().setSecret(secret);
        props.setAccessTtl(Duration.ofMinutes(60));
        props.setRefreshTtl(Duration.ofHours(168));
        props.setClockSkew(Duration.ZERO);
        return props;
    }
}
