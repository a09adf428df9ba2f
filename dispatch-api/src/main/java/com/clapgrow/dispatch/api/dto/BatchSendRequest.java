package com.clapgrow.dispatch.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;

@Data
public class BatchSendRequest {
    @NotEmpty(message = "Messages are required")
    @Size(max = 500, message = "A batch may contain at most 500 messages")
    private List<@Valid SendMessageRequest> messages;
}
