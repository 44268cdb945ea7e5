package com.tasknest.todoservice.SecurityConfig;

import com.tasknest.todoservice.config.TokenProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.JwtParserBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.security.SecurityException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Objects;
import java.util.UUID;

import static com.tasknest.todoservice.SecurityConfig.TokenVerificationException.Reason.*;

/**
 * Issues and verifies signed session tokens (HS256).
 * Stateless: everything needed to check a token travels inside it, and the
 * only server-side state is the denylist keyed by jti.
 */
@Slf4j
@Component
public class JwtTokenProviderConfig {

    static final String KIND_CLAIM = "kind";

    private final Clock clock;
    private final String issuerOpt;
    private final String audienceOpt;

    /** Cached signing key & parser for performance */
    private final SecretKey signingKey;
    private final JwtParser jwtParser;

    public JwtTokenProviderConfig(TokenProperties properties, Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        TokenProperties.Key key = properties.getKey();
        this.issuerOpt = key.getIssuer();
        this.audienceOpt = key.getAudience();
        this.signingKey = SigningKeys.master(key.getSecret());

        // Reusable, thread-safe parser; enforce iss/aud only when configured
        JwtParserBuilder parserBuilder = Jwts.parser()
                .verifyWith(signingKey)
                .clock(() -> Date.from(this.clock.instant()))
                .clockSkewSeconds(Math.max(0, properties.getClockSkew().toSeconds()));

        if (hasText(issuerOpt)) {
            parserBuilder = parserBuilder.requireIssuer(issuerOpt);
        }
        if (hasText(audienceOpt)) {
            parserBuilder = parserBuilder.requireAudience(audienceOpt);
        }
        this.jwtParser = parserBuilder.build();
    }

    /** Sign a new token for {@code subject}; expiry is now + ttl. */
    public IssuedToken issue(String subject, TokenKind kind, Duration ttl) {
        Objects.requireNonNull(subject, "subject is required");
        Objects.requireNonNull(kind, "kind is required");
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }

        // JWT dates have second precision
        Instant now = clock.instant().truncatedTo(java.time.temporal.ChronoUnit.SECONDS);
        Instant expiresAt = now.plus(ttl);
        String jti = UUID.randomUUID().toString().replace("-", "");

        JwtBuilder builder = Jwts.builder()
                .id(jti)
                .subject(subject)
                .claim(KIND_CLAIM, kind.claimValue())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiresAt));

        if (hasText(issuerOpt)) {
            builder.issuer(issuerOpt);
        }
        if (hasText(audienceOpt)) {
            builder.audience().add(audienceOpt).and();
        }

        String token = builder
                .signWith(signingKey, Jwts.SIG.HS256)
                .compact();
        return new IssuedToken(token, jti, expiresAt);
    }

    /**
     * Verify signature, expiry, required claims and kind.
     *
     * @throws TokenVerificationException with the reason that failed first
     */
    public TokenClaims verify(String token, TokenKind expectedKind) {
        Objects.requireNonNull(expectedKind, "expectedKind is required");
        if (token == null || token.isBlank()) {
            throw new TokenVerificationException(MALFORMED, "Token is empty");
        }

        final Claims claims;
        try {
            claims = jwtParser.parseSignedClaims(token).getPayload();
        } catch (ExpiredJwtException e) {
            throw new TokenVerificationException(EXPIRED, "Token has expired", e);
        } catch (SecurityException e) {
            throw new TokenVerificationException(SIGNATURE_INVALID, "Token signature is invalid", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new TokenVerificationException(MALFORMED, "Token could not be parsed", e);
        }

        String subject = claims.getSubject();
        String jti = claims.getId();
        Date exp = claims.getExpiration();
        Object rawKind = claims.get(KIND_CLAIM);
        if (!hasText(subject) || !hasText(jti) || exp == null || !(rawKind instanceof String)) {
            throw new TokenVerificationException(MALFORMED, "Token is missing required claims");
        }

        TokenKind kind = TokenKind.fromClaim((String) rawKind)
                .orElseThrow(() -> new TokenVerificationException(MALFORMED, "Unknown token kind"));
        if (kind != expectedKind) {
            throw new TokenVerificationException(KIND_MISMATCH,
                    "Expected " + expectedKind.claimValue() + " token but got " + kind.claimValue());
        }

        Date iat = claims.getIssuedAt();
        return new TokenClaims(
                subject,
                kind,
                jti,
                iat != null ? iat.toInstant() : null,
                exp.toInstant());
    }

    /** Unique identifier of a verified token, for revocation. */
    public String extractJti(String token, TokenKind expectedKind) {
        return verify(token, expectedKind).jti();
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
