package com.clapgrow.dispatch.api.dto;

import java.util.List;

/**
 * @param provider  display name of the bound provider
 * @param available config values of every enabled provider
 */
public record ProviderResponse(
    String provider,
    List<String> available
) {
}
