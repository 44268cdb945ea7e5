package com.tasknest.todoservice.exception;

import org.springframework.http.HttpStatus;

public final class ResourceExceptions {

    private ResourceExceptions() {}

    /** 404 Not Found – Target resource does not exist (or is not owned by the caller). */
    public static final class NotFound extends ApiException {
        public NotFound(String detail) {
            super(HttpStatus.NOT_FOUND,
                    "https://tasknest.dev/problems/not-found",
                    "Resource Not Found",
                    detail);
        }
    }
}
