package com.clapgrow.dispatch.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ProviderSwitchRequest {
    @NotBlank(message = "Provider is required")
    private String provider;
}
