package com.github.dimitryivaniuta.pack.api.web;

import com.github.dimitryivaniuta.common.web.ApiError;
import com.github.dimitryivaniuta.pack.error.PackErrorCode;
import com.github.dimitryivaniuta.pack.error.PackException;
import jakarta.validation.ConstraintViolationException;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

/** Renders every failure as {@link ApiError} with the status of its error code. */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(PackException.class)
    public ResponseEntity<ApiError> onPackException(PackException e) {
        HttpStatus status = statusOf(e.getCode());
        if (status.is5xxServerError()) {
            log.error("Request failed: {}", e.getMessage(), e);
        } else {
            log.debug("Request rejected: {} {}", e.getCode(), e.getMessage());
        }
        return ResponseEntity.status(status).body(ApiError.of(e.getCode().name(), e.getMessage(), e.getDetails()));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ApiError> onBindException(WebExchangeBindException e) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (FieldError fe : e.getFieldErrors()) {
            fields.putIfAbsent(fe.getField(), fe.getDefaultMessage());
        }
        return ResponseEntity.badRequest()
                .body(ApiError.of(PackErrorCode.VALIDATION.name(), "Request validation failed", fields));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> onConstraintViolation(ConstraintViolationException e) {
        Map<String, Object> violations = new LinkedHashMap<>();
        e.getConstraintViolations().forEach(v -> violations.putIfAbsent(v.getPropertyPath().toString(), v.getMessage()));
        return ResponseEntity.badRequest()
                .body(ApiError.of(PackErrorCode.VALIDATION.name(), "Request validation failed", violations));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ApiError> onInputException(ServerWebInputException e) {
        return ResponseEntity.badRequest()
                .body(ApiError.of(PackErrorCode.VALIDATION.name(), e.getReason() != null ? e.getReason() : "Malformed request"));
    }

    static HttpStatus statusOf(PackErrorCode code) {
        return switch (code) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case UNKNOWN_PACK -> HttpStatus.NOT_FOUND;
            case INSUFFICIENT_FUNDS -> HttpStatus.PAYMENT_REQUIRED;
            case IDEMPOTENCY_CONFLICT, IDEMPOTENCY_IN_PROGRESS, NO_PENDING -> HttpStatus.CONFLICT;
            case NO_MATCHING_ITEMS -> HttpStatus.UNPROCESSABLE_ENTITY;
            case CATALOG_MISCONFIGURED, STORAGE_FAILURE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
