package com.tasknest.todoservice.utils;

import com.tasknest.todoservice.model.ApiResponse;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.json.AbstractJackson2HttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

/**
 * Wraps successful JSON responses of this service's controllers in {@link ApiResponse}:
 * <pre>
 * { "timestamp": "...Z", "requestId": "...", "message": "OK", "data": {...} }
 * </pre>
 * ProblemDetail bodies, non-2xx statuses and springdoc's own endpoints pass through untouched.
 */
@RestControllerAdvice(basePackages = "com.tasknest.todoservice.controller")
public class SuccessEnvelopeAdvice implements ResponseBodyAdvice<Object> {

    private static final String REQ_ID_HEADER = "X-Request-Id";

    @Override
    public boolean supports(@NonNull MethodParameter returnType,
                            @NonNull Class<? extends HttpMessageConverter<?>> converterType) {
        // String bodies go through StringHttpMessageConverter and cannot carry a record
        return AbstractJackson2HttpMessageConverter.class.isAssignableFrom(converterType);
    }

    @Override
    public Object beforeBodyWrite(@Nullable Object body,
                                  @NonNull MethodParameter returnType,
                                  @NonNull MediaType selectedContentType,
                                  @NonNull Class<? extends HttpMessageConverter<?>> selectedConverterType,
                                  @NonNull ServerHttpRequest request,
                                  @NonNull ServerHttpResponse response) {

        if (body == null || body instanceof ProblemDetail || body instanceof ApiResponse<?>) return body;
        if (MediaType.APPLICATION_PROBLEM_JSON.includes(selectedContentType)) return body;

        if (response instanceof ServletServerHttpResponse sResp) {
            HttpStatus status = HttpStatus.resolve(sResp.getServletResponse().getStatus());
            if (status != null && !status.is2xxSuccessful()) return body;
        }

        return ApiResponse.of(requestId(request, response), resolveMessage(returnType), body);
    }

    /** From @ResponseMessage on the method, then the controller; default "OK". */
    private String resolveMessage(@NonNull MethodParameter returnType) {
        ResponseMessage ann = returnType.getMethodAnnotation(ResponseMessage.class);
        if (ann == null) {
            ann = returnType.getContainingClass().getAnnotation(ResponseMessage.class);
        }
        return (ann != null && StringUtils.hasText(ann.value())) ? ann.value() : "OK";
    }

    private String requestId(@NonNull ServerHttpRequest req, @NonNull ServerHttpResponse resp) {
        String id = req.getHeaders().getFirst(REQ_ID_HEADER);
        if (!StringUtils.hasText(id)) {
            id = resp.getHeaders().getFirst(REQ_ID_HEADER);
        }
        return StringUtils.hasText(id) ? id : null;
    }
}
