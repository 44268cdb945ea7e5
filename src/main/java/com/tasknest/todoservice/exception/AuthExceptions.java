package com.tasknest.todoservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Authentication failures. The detail text is deliberately the same for every
 * cause so clients cannot tell which check rejected them.
 */
public final class AuthExceptions {

    private AuthExceptions() {}

    /** 401 – Token is invalid, expired, revoked or of the wrong kind. */
    public static final class Unauthorized extends ApiException {
        public Unauthorized() {
            super(HttpStatus.UNAUTHORIZED,
                    "https://tasknest.dev/problems/unauthorized",
                    "Unauthorized",
                    "Could not validate credentials: please provide a valid token.");
        }
    }

    /** 401 – Unknown username or wrong password (indistinguishable). */
    public static final class InvalidCredentials extends ApiException {
        public InvalidCredentials() {
            super(HttpStatus.UNAUTHORIZED,
                    "https://tasknest.dev/problems/invalid-credentials",
                    "Invalid Credentials",
                    "Incorrect username or password.");
        }
    }
}
