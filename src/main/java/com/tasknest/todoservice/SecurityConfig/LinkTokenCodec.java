package com.tasknest.todoservice.SecurityConfig;

import com.tasknest.todoservice.config.TokenProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Signed payloads for email verification and password-reset links.
 * <p>
 * Keys are derived from the master secret with {@code token.link.salt} plus the
 * link purpose, so a link token never verifies as a session token, and a
 * verification link cannot be replayed as a reset link.
 * There is no exp claim: the age is checked against iat at decode time.
 * Any failure decodes to {@link Optional#empty()}.
 */
@Slf4j
@Component
public class LinkTokenCodec {

    private final Clock clock;
    private final Duration defaultMaxAge;
    private final Map<LinkPurpose, SecretKey> keys = new EnumMap<>(LinkPurpose.class);
    private final Map<LinkPurpose, JwtParser> parsers = new EnumMap<>(LinkPurpose.class);

    public LinkTokenCodec(TokenProperties properties, Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.defaultMaxAge = properties.getLink().getMaxAge();
        String salt = properties.getLink().getSalt();
        for (LinkPurpose purpose : LinkPurpose.values()) {
            SecretKey key = SigningKeys.derived(properties.getKey().getSecret(), salt + ":" + purpose.namespace());
            keys.put(purpose, key);
            parsers.put(purpose, Jwts.parser()
                    .verifyWith(key)
                    .clock(() -> Date.from(this.clock.instant()))
                    .build());
        }
    }

    public String encode(LinkPurpose purpose, String payload) {
        Objects.requireNonNull(purpose, "purpose is required");
        Objects.requireNonNull(payload, "payload is required");
        return Jwts.builder()
                .subject(payload)
                .issuedAt(Date.from(clock.instant().truncatedTo(ChronoUnit.SECONDS)))
                .signWith(keys.get(purpose), Jwts.SIG.HS256)
                .compact();
    }

    public Optional<String> decode(LinkPurpose purpose, String token) {
        return decode(purpose, token, defaultMaxAge);
    }

    public Optional<String> decode(LinkPurpose purpose, String token, Duration maxAge) {
        Objects.requireNonNull(purpose, "purpose is required");
        if (token == null || token.isBlank()) return Optional.empty();
        try {
            Claims claims = parsers.get(purpose).parseSignedClaims(token).getPayload();
            Date iat = claims.getIssuedAt();
            if (claims.getSubject() == null || iat == null) {
                return Optional.empty();
            }
            Instant issuedAt = iat.toInstant();
            if (maxAge != null && issuedAt.plus(maxAge).isBefore(clock.instant())) {
                log.debug("{} link older than {}", purpose, maxAge);
                return Optional.empty();
            }
            return Optional.of(claims.getSubject());
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("{} link rejected: {}", purpose, e.getMessage());
            return Optional.empty();
        }
    }
}
