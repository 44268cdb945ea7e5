package com.tasknest.todoservice.SecurityConfig;

import io.jsonwebtoken.io.DecodingException;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;

import javax.crypto.Mac;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;

/**
 * Turns the configured master secret into HMAC keys. Session tokens sign with
 * the master key itself; other token families get a key derived per salt.
 */
final class SigningKeys {

    private static final int MIN_KEY_BYTES = 32; // HS256

    private SigningKeys() {}

    static byte[] decodeSecret(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("JWT secret must be provided (base64).");
        }
        final byte[] keyBytes;
        try {
            keyBytes = Decoders.BASE64.decode(secret.trim());
        } catch (DecodingException | IllegalArgumentException e) {
            throw new IllegalStateException("JWT secret must be valid Base64.", e);
        }
        if (keyBytes.length < MIN_KEY_BYTES) {
            throw new IllegalStateException("JWT secret too short for HS256. Provide >= 256-bit Base64 key.");
        }
        return keyBytes;
    }

    static SecretKey master(String secret) {
        return Keys.hmacShaKeyFor(decodeSecret(secret));
    }

    static SecretKey derived(String secret, String salt) {
        if (salt == null || salt.isBlank()) {
            throw new IllegalStateException("Link token salt must not be blank.");
        }
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(decodeSecret(secret), "HmacSHA256"));
            byte[] derived = mac.doFinal(("tasknest.todoservice:" + salt).getBytes(StandardCharsets.UTF_8));
            return Keys.hmacShaKeyFor(derived);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to derive link signing key", e);
        }
    }
}
