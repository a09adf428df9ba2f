package com.clapgrow.dispatch.common.message;

import java.time.Instant;

/**
 * Outcome of one delivery attempt.
 *
 * Immutable result object returned by every adapter operation. Ordinary delivery failures are
 * reported through {@link #failed} rather than thrown, so callers can treat them as data.
 *
 * Example usage:
 * <pre>
 * MessageResult result = adapter.send(message, signal);
 * if (!result.isSuccess()) {
 *     log.error("Delivery failed on {}: {}", result.provider(), result.errorMessage());
 * }
 * </pre>
 *
 * @param success      whether the backend accepted the message
 * @param messageId    id of the delivered message, null for most failures
 * @param provider     provider display name, DLQ hand-offs carry the "-DLQ" suffix
 * @param errorMessage failure description, null on success
 * @param cause        underlying fault if one was raised
 * @param processedAt  when this result was produced
 */
public record MessageResult(
    boolean success,
    String messageId,
    String provider,
    String errorMessage,
    Throwable cause,
    Instant processedAt
) {

    public static MessageResult successful(String messageId, String provider) {
        return new MessageResult(true, messageId, provider, null, null, Instant.now());
    }

    public static MessageResult failed(String errorMessage) {
        return failed(errorMessage, null, null);
    }

    public static MessageResult failed(String errorMessage, Throwable cause) {
        return failed(errorMessage, cause, null);
    }

    public static MessageResult failed(String errorMessage, Throwable cause, String provider) {
        return new MessageResult(false, null, provider, errorMessage, cause, Instant.now());
    }

    public boolean isSuccess() {
        return success;
    }
}
