package com.tasknest.todoservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Failures caused by infrastructure this service depends on (Redis).
 * Not retried here; the caller sees a 5xx and may retry the whole request.
 */
public final class ExternalExceptions {

    private ExternalExceptions() {}

    /** 503 Service Unavailable – A backing store could not be reached. */
    public static final class UpstreamUnavailable extends ApiException {
        public UpstreamUnavailable(String detail) {
            super(HttpStatus.SERVICE_UNAVAILABLE,
                    "https://tasknest.dev/problems/upstream-unavailable",
                    "Upstream Unavailable",
                    detail);
        }
    }
}
