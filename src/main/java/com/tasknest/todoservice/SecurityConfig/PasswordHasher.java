package com.tasknest.todoservice.SecurityConfig;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * One-way password hashing over the configured {@link PasswordEncoder} (BCrypt).
 * Callers only get a boolean: a malformed stored digest is logged, then
 * reported as "no match".
 */
@Slf4j
@Component
public class PasswordHasher {

    private final PasswordEncoder passwordEncoder;

    /** Compared against when the account does not exist, to keep timing flat. */
    private final String dummyDigest;

    public PasswordHasher(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = Objects.requireNonNull(passwordEncoder, "passwordEncoder");
        this.dummyDigest = passwordEncoder.encode("timing-equaliser-0");
    }

    public String hash(String secret) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("secret must not be empty");
        }
        return passwordEncoder.encode(secret);
    }

    public boolean verify(String secret, String digest) {
        if (secret == null || digest == null || digest.isBlank()) {
            return false;
        }
        try {
            return passwordEncoder.matches(secret, digest);
        } catch (IllegalArgumentException e) {
            log.warn("Stored password digest is malformed: {}", e.getMessage());
            return false;
        }
    }

    /** Burn the same CPU as a real check. Always false. */
    public boolean verifyAgainstDummy(String secret) {
        verify(secret == null ? "" : secret, dummyDigest);
        return false;
    }
}
