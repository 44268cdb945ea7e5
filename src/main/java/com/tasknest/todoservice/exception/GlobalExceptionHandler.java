package com.tasknest.todoservice.exception;

import com.tasknest.todoservice.utils.ErrorResponseWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.ConstraintViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.io.IOException;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final ErrorResponseWriter writer;

    // ---------- Custom domain / API exceptions ----------

    @ExceptionHandler(ApiException.class)
    public void handleApiException(@NonNull HttpServletRequest req,
                                   @NonNull HttpServletResponse resp,
                                   @NonNull ApiException ex) throws IOException {
        if (ex.getStatus().is5xxServerError()) {
            log.error("ApiException: status={}, type={}, detail={}", ex.getStatus(), ex.getType(), ex.getMessage());
        } else {
            log.debug("ApiException: status={}, type={}, title={}, detail={}",
                    ex.getStatus(), ex.getType(), ex.getTitle(), ex.getMessage());
        }
        if (ex.getStatus() == HttpStatus.UNAUTHORIZED) {
            resp.setHeader("WWW-Authenticate", "Bearer");
        }
        writer.write(req, resp, ex.getStatus(), ex.getType(), ex.getTitle(), safeDetail(ex.getMessage()));
    }

    // ---------- Validation & request-shape errors ----------

    // MethodArgumentNotValidException for JSON bodies, plain BindException for form logins
    @ExceptionHandler(BindException.class)
    public void handleBindingErrors(@NonNull HttpServletRequest req,
                                    @NonNull HttpServletResponse resp,
                                    @NonNull BindException ex) throws IOException {
        var details = ex.getBindingResult().getFieldErrors().stream()
                .limit(5) // keep payload small
                .map(fe -> fe.getField() + ": " + (fe.getDefaultMessage() != null ? fe.getDefaultMessage() : "invalid"))
                .collect(Collectors.joining("; "));
        writer.write(req, resp, HttpStatus.UNPROCESSABLE_ENTITY,
                "https://tasknest.dev/problems/validation-error",
                "Validation Error",
                details.isBlank() ? "Request validation failed." : details);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public void handleConstraintViolation(@NonNull HttpServletRequest req,
                                          @NonNull HttpServletResponse resp,
                                          @NonNull ConstraintViolationException ex) throws IOException {
        var details = ex.getConstraintViolations().stream()
                .limit(5)
                .map(cv -> cv.getPropertyPath() + ": " + cv.getMessage())
                .collect(Collectors.joining("; "));
        writer.write(req, resp, HttpStatus.UNPROCESSABLE_ENTITY,
                "https://tasknest.dev/problems/validation-error",
                "Validation Error",
                details.isBlank() ? "Request validation failed." : details);
    }

    @ExceptionHandler({ MissingServletRequestParameterException.class, HttpMessageNotReadableException.class })
    public void handleBadRequest(@NonNull HttpServletRequest req,
                                 @NonNull HttpServletResponse resp,
                                 @NonNull Exception ex) throws IOException {
        writer.write(req, resp, HttpStatus.BAD_REQUEST,
                "https://tasknest.dev/problems/bad-request",
                "Bad Request",
                "Malformed or missing request parameters.");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public void handleTypeMismatch(@NonNull HttpServletRequest req,
                                   @NonNull HttpServletResponse resp,
                                   @NonNull MethodArgumentTypeMismatchException ex) throws IOException {
        writer.write(req, resp, HttpStatus.BAD_REQUEST,
                "https://tasknest.dev/problems/type-mismatch",
                "Type Mismatch",
                "Parameter '" + ex.getName() + "' has invalid type.");
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public void handleMethodNotAllowed(@NonNull HttpServletRequest req,
                                       @NonNull HttpServletResponse resp,
                                       @NonNull HttpRequestMethodNotSupportedException ex) throws IOException {
        writer.write(req, resp, HttpStatus.METHOD_NOT_ALLOWED,
                "https://tasknest.dev/problems/method-not-allowed",
                "Method Not Allowed",
                "HTTP method not supported for this endpoint.");
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public void handleUnsupportedMediaType(@NonNull HttpServletRequest req,
                                           @NonNull HttpServletResponse resp,
                                           @NonNull HttpMediaTypeNotSupportedException ex) throws IOException {
        writer.write(req, resp, HttpStatus.UNSUPPORTED_MEDIA_TYPE,
                "https://tasknest.dev/problems/unsupported-media-type",
                "Unsupported Media Type",
                "Content type is not supported.");
    }

    // ---------- Data conflicts ----------

    // Lost race on the unique username/email indexes after the existence checks passed.
    @ExceptionHandler(DataIntegrityViolationException.class)
    public void handleDataIntegrity(@NonNull HttpServletRequest req,
                                    @NonNull HttpServletResponse resp,
                                    @NonNull DataIntegrityViolationException ex) throws IOException {
        log.debug("DataIntegrityViolation: {}", ex.getMostSpecificCause().getMessage());
        writer.write(req, resp, HttpStatus.CONFLICT,
                "https://tasknest.dev/problems/conflict",
                "Conflict",
                "A conflicting resource already exists or violates a constraint.");
    }

    // ---------- Fallback 500 ----------

    @ExceptionHandler(Exception.class)
    public void handleGeneric(@NonNull HttpServletRequest req,
                              @NonNull HttpServletResponse resp,
                              @NonNull Exception ex) throws IOException {
        log.error("Unhandled exception", ex);
        writer.write(req, resp, HttpStatus.INTERNAL_SERVER_ERROR,
                "https://tasknest.dev/problems/internal-error",
                "Internal Server Error",
                "An unexpected error occurred.");
    }

    private String safeDetail(String s) {
        return (s == null || s.isBlank()) ? "Request could not be processed." : s;
    }
}
