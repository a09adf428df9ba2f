package com.clapgrow.dispatch.api.dto;

import java.util.List;

public record BatchResultResponse(
    int total,
    int succeeded,
    int failed,
    List<MessageResultResponse> results
) {
    public static BatchResultResponse of(List<MessageResultResponse> results) {
        int succeeded = (int) results.stream().filter(MessageResultResponse::success).count();
        return new BatchResultResponse(results.size(), succeeded, results.size() - succeeded, results);
    }
}
