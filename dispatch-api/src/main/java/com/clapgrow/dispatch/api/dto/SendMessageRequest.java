package com.clapgrow.dispatch.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.Map;

@Data
public class SendMessageRequest {
    @NotBlank(message = "Topic is required")
    @Size(max = 249, message = "Topic must be at most 249 characters")
    private String topic;

    @NotNull(message = "Payload is required")
    private JsonNode payload;

    private String correlationId;

    private Map<String, String> headers;
}
