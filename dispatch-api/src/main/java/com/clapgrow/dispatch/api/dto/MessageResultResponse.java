package com.clapgrow.dispatch.api.dto;

import com.clapgrow.dispatch.common.message.MessageResult;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Outcome of one dispatch as returned over HTTP. The underlying fault is reduced to its message.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MessageResultResponse(
    boolean success,
    String messageId,
    String provider,
    String error,
    Integer retryCount,
    Instant processedAt
) {
    public static MessageResultResponse from(MessageResult result, Integer retryCount) {
        return new MessageResultResponse(
            result.success(),
            result.messageId(),
            result.provider(),
            result.errorMessage(),
            retryCount,
            result.processedAt());
    }
}
