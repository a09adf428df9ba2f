package com.clapgrow.dispatch.api.controller;

import com.clapgrow.dispatch.api.dto.ApiResponse;
import com.clapgrow.dispatch.api.dto.BatchResultResponse;
import com.clapgrow.dispatch.api.dto.BatchSendRequest;
import com.clapgrow.dispatch.api.dto.MessageResultResponse;
import com.clapgrow.dispatch.api.dto.MessagingHealthResponse;
import com.clapgrow.dispatch.api.dto.ProviderResponse;
import com.clapgrow.dispatch.api.dto.ProviderSwitchRequest;
import com.clapgrow.dispatch.api.dto.SendMessageRequest;
import com.clapgrow.dispatch.api.dto.SendToDlqRequest;
import com.clapgrow.dispatch.api.dto.SendWithRetryRequest;
import com.clapgrow.dispatch.api.service.MessagingApplicationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/messaging")
@RequiredArgsConstructor
@Tag(name = "Messaging", description = "Outbound message dispatch")
public class MessagingController {

    private final MessagingApplicationService messagingService;

    @PostMapping("/send")
    @Operation(summary = "Send a message", description = "Single delivery attempt through the bound provider.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Delivered"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "502", description = "Backend rejected the message")
    })
    public ResponseEntity<ApiResponse<MessageResultResponse>> send(@Valid @RequestBody SendMessageRequest request) {
        return toResponse(messagingService.sendMessage(request));
    }

    @PostMapping("/send-with-retry")
    @Operation(summary = "Send with retry",
            description = "Retries with backoff, then hands the message to the dead-letter queue if enabled by the policy.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Delivered or dead-lettered"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "502", description = "Retries exhausted and no successful DLQ hand-off")
    })
    public ResponseEntity<ApiResponse<MessageResultResponse>> sendWithRetry(
            @Valid @RequestBody SendWithRetryRequest request) {
        return toResponse(messagingService.sendWithRetry(request, request.getRetryPolicy()));
    }

    @PostMapping("/batch")
    @Operation(summary = "Send a batch", description = "One result per message; failures do not abort the rest.")
    public ResponseEntity<ApiResponse<BatchResultResponse>> sendBatch(@Valid @RequestBody BatchSendRequest request) {
        return ResponseEntity.ok(ApiResponse.success(messagingService.sendBatch(request.getMessages())));
    }

    @PostMapping("/dlq")
    @Operation(summary = "Dead-letter a message", description = "Sends the message straight to its dead-letter destination.")
    public ResponseEntity<ApiResponse<MessageResultResponse>> sendToDlq(@Valid @RequestBody SendToDlqRequest request) {
        return toResponse(messagingService.sendToDlq(request, request.getReason()));
    }

    @GetMapping("/health")
    @Operation(summary = "Provider health", description = "Liveness probe of the bound messaging provider.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Provider is healthy"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Provider is unhealthy")
    })
    public ResponseEntity<ApiResponse<MessagingHealthResponse>> health() {
        MessagingHealthResponse health = messagingService.checkHealth();
        if (health.healthy()) {
            return ResponseEntity.ok(ApiResponse.success(health));
        }
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ApiResponse.error(health, "Messaging provider " + health.provider() + " is unhealthy"));
    }

    @GetMapping("/provider")
    @Operation(summary = "Current provider")
    public ResponseEntity<ApiResponse<ProviderResponse>> currentProvider() {
        return ResponseEntity.ok(ApiResponse.success(messagingService.currentProvider()));
    }

    @PutMapping("/provider")
    @Operation(summary = "Switch provider", description = "Hot-swaps the bound provider. Only enabled providers are accepted.")
    public ResponseEntity<ApiResponse<ProviderResponse>> switchProvider(
            @Valid @RequestBody ProviderSwitchRequest request) {
        return ResponseEntity.ok(ApiResponse.success(messagingService.switchProvider(request.getProvider())));
    }

    private static ResponseEntity<ApiResponse<MessageResultResponse>> toResponse(MessageResultResponse result) {
        if (result.success()) {
            return ResponseEntity.ok(ApiResponse.success(result));
        }
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ApiResponse.error(result, result.error()));
    }
}
