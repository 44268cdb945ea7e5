package com.tasknest.todoservice.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Signing material and lifetimes for session and link tokens.
 * Bound once at startup and handed to the codecs and the session manager.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "token")
public class TokenProperties {

    private Key key = new Key();

    /** Lifetime of access tokens. */
    private Duration accessTtl = Duration.ofMinutes(60);

    private Duration refreshTtl = Duration.ofHours(168);

    /** Tolerated drift when checking exp. Denylist entries outlive exp by this much. */
    private Duration clockSkew = Duration.ofSeconds(30);

    private Revocation revocation = new Revocation();

    private Link link = new Link();

    @Getter
    @Setter
    public static class Key {
        /** Base64-encoded HMAC secret, at least 256 bits. */
        private String secret;
        private String issuer;
        private String audience;
    }

    @Getter
    @Setter
    public static class Revocation {
        /** Also consult the denylist for refresh tokens. */
        private boolean checkRefresh = false;
    }

    @Getter
    @Setter
    public static class Link {
        private String salt = "email-link";
        private Duration maxAge = Duration.ofHours(1);
    }
}
