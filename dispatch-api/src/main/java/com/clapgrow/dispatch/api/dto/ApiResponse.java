package com.clapgrow.dispatch.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Response envelope shared by every messaging endpoint.
 *
 * Example usage:
 * <pre>
 * {@code
 * return ResponseEntity.ok(ApiResponse.success(data));
 * return ResponseEntity.status(502).body(ApiResponse.error(data, "Kafka send failed"));
 * }
 * </pre>
 *
 * @param <T> Type of the data payload
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
    boolean success,
    T data,
    String error
) {
    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(true, data, null);
    }

    /**
     * Error response that still carries a body, e.g. the failed delivery result.
     */
    public static <T> ApiResponse<T> error(T data, String error) {
        return new ApiResponse<>(false, data, error);
    }
}
