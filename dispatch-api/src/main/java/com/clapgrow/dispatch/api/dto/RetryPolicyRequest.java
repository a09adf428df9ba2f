package com.clapgrow.dispatch.api.dto;

import com.clapgrow.dispatch.common.retry.RetryPolicy;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.time.Duration;

/**
 * Per-request retry overrides. Absent fields keep the configured default.
 */
@Data
public class RetryPolicyRequest {
    @PositiveOrZero(message = "maxRetries must be zero or positive")
    @Max(value = 10, message = "maxRetries must be at most 10")
    private Integer maxRetries;

    @PositiveOrZero(message = "baseDelayMs must be zero or positive")
    @Max(value = 60000, message = "baseDelayMs must be at most 60000")
    private Long baseDelayMs;

    @PositiveOrZero(message = "maxDelayMs must be zero or positive")
    @Max(value = 300000, message = "maxDelayMs must be at most 300000")
    private Long maxDelayMs;

    private Boolean exponentialBackoff;

    private Boolean sendToDlqOnExhaustion;

    public RetryPolicy applyTo(RetryPolicy defaults) {
        RetryPolicy policy = defaults;
        if (maxRetries != null) {
            policy = policy.withMaxRetries(maxRetries);
        }
        if (baseDelayMs != null) {
            policy = policy.withBaseDelay(Duration.ofMillis(baseDelayMs));
        }
        if (maxDelayMs != null) {
            policy = policy.withMaxDelay(Duration.ofMillis(maxDelayMs));
        }
        if (exponentialBackoff != null) {
            policy = policy.withExponentialBackoff(exponentialBackoff);
        }
        if (sendToDlqOnExhaustion != null) {
            policy = policy.withSendToDlqOnExhaustion(sendToDlqOnExhaustion);
        }
        return policy;
    }
}
