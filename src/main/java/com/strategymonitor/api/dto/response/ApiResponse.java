package com.strategymonitor.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.strategymonitor.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Body of every {@code /api} response. Exactly one of {@code data} and {@code error} is set.
 *
 * <p>Controllers return plain DTOs; {@code ApiResponseAdvice} wraps them with {@link #of}.
 * {@code GlobalExceptionHandler} builds failures with {@link #failure}.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private final boolean success;
    private final T data;
    private final Failure error;
    private final Instant timestamp;

    private ApiResponse(boolean success, T data, Failure error) {
        this.success = success;
        this.data = data;
        this.error = error;
        this.timestamp = Instant.now();
    }

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static ApiResponse<Void> failure(
            ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        Failure failure = Failure.builder()
                .code(errorCode.getCode())
                .message(message)
                .details(details == null || details.isEmpty() ? null : details)
                .retryable(errorCode.isRetryable())
                .path(path)
                .build();
        return new ApiResponse<>(false, null, failure);
    }

    /**
     * Machine-readable failure. {@code details} carries the offending input where there is
     * one: field errors, the unparsed description, the missing parameter.
     */
    @Getter
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Failure {
        private final String code;
        private final String message;
        private final Map<String, Object> details;
        private final boolean retryable;
        private final String path;
    }
}
