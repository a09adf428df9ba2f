package com.clapgrow.dispatch.api.dto;

import java.time.Instant;

public record MessagingHealthResponse(
    boolean healthy,
    String provider,
    Instant timestamp
) {
}
