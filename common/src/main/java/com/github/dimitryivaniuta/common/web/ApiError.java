package com.github.dimitryivaniuta.common.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.extern.jackson.Jacksonized;

/** Standardized API error payload. */
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ApiError(
        String code,
        String message,
        Instant timestamp,
        Map<String, Object> details
) {
    public static ApiError of(String code, String message) {
        return ApiError.builder().code(code).message(message).timestamp(Instant.now()).build();
    }

    public static ApiError of(String code, String message, Map<String, Object> details) {
        return ApiError.builder().code(code).message(message).timestamp(Instant.now()).details(details).build();
    }
}
