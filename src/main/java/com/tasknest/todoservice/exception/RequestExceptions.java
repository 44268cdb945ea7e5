package com.tasknest.todoservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Exceptions representing problems with the incoming client request itself.
 *
 * Conventions:
 *  - type:  https://tasknest.dev/problems/<slug>
 *  - title: short, human-readable summary
 *  - detail: safe, non-sensitive explanation suitable for clients
 */
public final class RequestExceptions {

    private RequestExceptions() {}

    /** 400 Bad Request – A required parameter is missing/blank/invalid. */
    public static final class InvalidParameter extends ApiException {
        public InvalidParameter(String detail) {
            super(HttpStatus.BAD_REQUEST,
                    "https://tasknest.dev/problems/invalid-parameter",
                    "Invalid Parameter",
                    detail);
        }
    }

    /**
     * 422 Unprocessable Entity – A credential policy or business rule was broken.
     * The detail names the rule.
     */
    public static final class ValidationFailed extends ApiException {
        public ValidationFailed(String detail) {
            super(HttpStatus.UNPROCESSABLE_ENTITY,
                    "https://tasknest.dev/problems/validation-failed",
                    "Validation Failed",
                    detail);
        }
    }
}
