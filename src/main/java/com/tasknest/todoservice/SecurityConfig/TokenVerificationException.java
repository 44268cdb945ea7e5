package com.tasknest.todoservice.SecurityConfig;

import lombok.Getter;

/**
 * Raised by the token codec. Never leaves the session layer as-is: AuthService
 * turns every reason into the same 401.
 */
@Getter
public class TokenVerificationException extends RuntimeException {

    public enum Reason {
        SIGNATURE_INVALID,
        MALFORMED,
        EXPIRED,
        KIND_MISMATCH
    }

    private final Reason reason;

    public TokenVerificationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TokenVerificationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
