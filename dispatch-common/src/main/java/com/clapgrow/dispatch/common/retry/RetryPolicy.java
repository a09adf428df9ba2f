package com.clapgrow.dispatch.common.retry;

import lombok.With;

import java.time.Duration;

/**
 * Retry policy configuration.
 *
 * Supplied per dispatch call, so different call sites may use different policies against the
 * same orchestrator. Negative counts and delays are clamped to zero; a null delay counts as zero.
 *
 * Example usage:
 * <pre>
 * RetryPolicy policy = RetryPolicy.defaults()
 *     .withMaxRetries(5)
 *     .withSendToDlqOnExhaustion(false);
 * </pre>
 *
 * @param maxRetries            retries after the first attempt, so up to maxRetries + 1 sends
 * @param baseDelay             wait before the first retry, and the constant wait without backoff
 * @param maxDelay              cap applied to exponential delays
 * @param exponentialBackoff    double the delay for each further retry
 * @param sendToDlqOnExhaustion hand the message to the dead-letter sink once retries run out
 */
@With
public record RetryPolicy(
    int maxRetries,
    Duration baseDelay,
    Duration maxDelay,
    boolean exponentialBackoff,
    boolean sendToDlqOnExhaustion
) {

    public RetryPolicy {
        maxRetries = Math.max(0, maxRetries);
        baseDelay = clamp(baseDelay);
        maxDelay = clamp(maxDelay);
    }

    /**
     * Standard policy: 3 retries, 1s base, 30s cap, exponential, DLQ on exhaustion.
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30), true, true);
    }

    /**
     * Single attempt, then straight to the dead-letter sink.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(0, Duration.ZERO, Duration.ZERO, false, true);
    }

    private static Duration clamp(Duration delay) {
        return delay == null || delay.isNegative() ? Duration.ZERO : delay;
    }
}
