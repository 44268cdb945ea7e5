package com.tasknest.todoservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Account-domain exceptions (registration, verification, password reset).
 *
 * Conventions:
 *  - type:  https://tasknest.dev/problems/<slug>
 */
public final class UserExceptions {

    private UserExceptions() {}

    /** 404 Not Found – Account record not present. */
    public static final class UserNotFound extends ApiException {
        public UserNotFound(String detail) {
            super(HttpStatus.NOT_FOUND,
                    "https://tasknest.dev/problems/user-not-found",
                    "User Not Found",
                    detail);
        }
    }

    /** 409 Conflict – Username already registered. */
    public static final class UsernameTaken extends ApiException {
        public UsernameTaken(String username) {
            super(HttpStatus.CONFLICT,
                    "https://tasknest.dev/problems/username-taken",
                    "Username already registered",
                    "Username '" + username + "' is already registered.");
        }
    }

    /** 409 Conflict – Email already registered. */
    public static final class EmailTaken extends ApiException {
        public EmailTaken(String email) {
            super(HttpStatus.CONFLICT,
                    "https://tasknest.dev/problems/email-taken",
                    "Email already registered",
                    "Email '" + email + "' is already registered.");
        }
    }
}
