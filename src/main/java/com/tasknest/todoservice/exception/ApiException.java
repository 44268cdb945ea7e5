package com.tasknest.todoservice.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base exception carrying HTTP semantics for RFC 7807 responses.
 * Throw these from services/controllers; GlobalExceptionHandler maps them.
 */
@Getter
public abstract class ApiException extends RuntimeException {

    private final HttpStatus status;
    private final String type;   // e.g., https://tasknest.dev/problems/not-found
    private final String title;  // short summary for ProblemDetail title

    protected ApiException(HttpStatus status, String type, String title, String detail) {
        super(detail);
        this.status = status;
        this.type = type;
        this.title = title;
    }
}
