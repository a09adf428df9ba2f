package com.clapgrow.dispatch.api.dto;

import jakarta.validation.Valid;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class SendWithRetryRequest extends SendMessageRequest {
    @Valid
    private RetryPolicyRequest retryPolicy;
}
