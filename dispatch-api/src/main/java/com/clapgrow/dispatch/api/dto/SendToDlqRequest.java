package com.clapgrow.dispatch.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class SendToDlqRequest extends SendMessageRequest {
    @NotBlank(message = "Reason is required")
    private String reason;
}
