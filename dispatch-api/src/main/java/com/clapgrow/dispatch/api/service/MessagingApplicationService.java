package com.clapgrow.dispatch.api.service;

import com.clapgrow.dispatch.api.adapter.MessageAdapterRegistry;
import com.clapgrow.dispatch.api.config.MessagingProperties;
import com.clapgrow.dispatch.api.dto.BatchResultResponse;
import com.clapgrow.dispatch.api.dto.MessageResultResponse;
import com.clapgrow.dispatch.api.dto.MessagingHealthResponse;
import com.clapgrow.dispatch.api.dto.ProviderResponse;
import com.clapgrow.dispatch.api.dto.RetryPolicyRequest;
import com.clapgrow.dispatch.api.dto.SendMessageRequest;
import com.clapgrow.dispatch.common.cancel.CancellationSignal;
import com.clapgrow.dispatch.common.dispatch.DispatchOrchestrator;
import com.clapgrow.dispatch.common.message.Message;
import com.clapgrow.dispatch.common.message.MessageResult;
import com.clapgrow.dispatch.common.provider.MessageAdapter;
import com.clapgrow.dispatch.common.provider.ProviderName;
import com.clapgrow.dispatch.common.retry.RetryPolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * HTTP-facing entry point to the dispatch orchestrator.
 *
 * Turns request DTOs into {@link Message}s, runs each call under a deadline derived from
 * {@code messaging.dispatch.request-timeout}, and records metrics for every outcome.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MessagingApplicationService {

    private final DispatchOrchestrator orchestrator;
    private final MessageAdapterRegistry adapterRegistry;
    private final MessagingProperties properties;
    private final DispatchMetricsService metricsService;
    private final ObjectMapper objectMapper;

    /**
     * Single attempt, no retry.
     */
    public MessageResultResponse sendMessage(SendMessageRequest request) {
        Message message = toMessage(request);
        ProviderName provider = currentProviderName();
        Timer.Sample sample = metricsService.startTimer();

        MessageResult result;
        try (CancellationSignal signal = requestSignal()) {
            result = orchestrator.send(message, signal);
        }

        metricsService.recordSendLatency(provider, sample);
        recordOutcome(provider, result);
        return MessageResultResponse.from(result, message.getRetryCount());
    }

    /**
     * Delivery with retry and dead-letter fallback.
     *
     * @param policyOverride per-request overrides on top of {@code messaging.retry.*}, may be null
     */
    public MessageResultResponse sendWithRetry(SendMessageRequest request, RetryPolicyRequest policyOverride) {
        Message message = toMessage(request);
        RetryPolicy policy = resolvePolicy(policyOverride);
        ProviderName provider = currentProviderName();
        Timer.Sample sample = metricsService.startTimer();

        MessageResult result;
        try (CancellationSignal signal = requestSignal()) {
            result = orchestrator.sendWithRetry(message, policy, signal);
        }

        metricsService.recordSendLatency(provider, sample);
        if (message.getRetryCount() > 0) {
            metricsService.recordRetried(provider, message.getRetryCount());
        }
        recordOutcome(provider, result);
        if (!result.isSuccess()) {
            log.error("Message {} to topic {} could not be delivered: {}",
                message.getId(), message.getTopic(), result.errorMessage());
        }
        return MessageResultResponse.from(result, message.getRetryCount());
    }

    public BatchResultResponse sendBatch(List<SendMessageRequest> requests) {
        List<Message> messages = new ArrayList<>(requests.size());
        for (SendMessageRequest request : requests) {
            messages.add(toMessage(request));
        }
        ProviderName provider = currentProviderName();
        Timer.Sample sample = metricsService.startTimer();

        List<MessageResult> results;
        try (CancellationSignal signal = requestSignal()) {
            results = orchestrator.sendBatch(messages, signal);
        }

        metricsService.recordSendLatency(provider, sample);
        List<MessageResultResponse> responses = new ArrayList<>(results.size());
        for (MessageResult result : results) {
            recordOutcome(provider, result);
            responses.add(MessageResultResponse.from(result, null));
        }
        BatchResultResponse response = BatchResultResponse.of(responses);
        log.info("Batch of {} messages via {}: {} succeeded, {} failed",
            response.total(), provider.getDisplayName(), response.succeeded(), response.failed());
        return response;
    }

    /**
     * Explicit dead-letter hand-off, bypassing delivery.
     */
    public MessageResultResponse sendToDlq(SendMessageRequest request, String reason) {
        Message message = toMessage(request);
        ProviderName provider = currentProviderName();

        MessageResult result;
        try (CancellationSignal signal = requestSignal()) {
            result = orchestrator.sendToDlq(message, reason, signal);
        }

        if (result.isSuccess()) {
            metricsService.recordDlq(provider);
        } else {
            metricsService.recordFailed(provider);
        }
        return MessageResultResponse.from(result, message.getRetryCount());
    }

    public MessagingHealthResponse checkHealth() {
        ProviderName provider = currentProviderName();
        boolean healthy;
        try (CancellationSignal signal = requestSignal()) {
            healthy = orchestrator.healthCheck(signal);
        }
        if (!healthy) {
            metricsService.recordHealthFailure(provider);
            log.warn("Messaging provider {} reported unhealthy", provider.getDisplayName());
        }
        return new MessagingHealthResponse(healthy, provider.getDisplayName(), Instant.now());
    }

    public ProviderResponse currentProvider() {
        return new ProviderResponse(orchestrator.getCurrentProvider(), availableProviders());
    }

    /**
     * Hot-swap the bound adapter. In-flight sends finish on the adapter they started with.
     *
     * @throws IllegalArgumentException if the provider is unknown or not enabled
     */
    public ProviderResponse switchProvider(String providerName) {
        MessageAdapter adapter = adapterRegistry.get(providerName);
        orchestrator.setProvider(adapter);
        log.info("Messaging provider switched to {}", adapter.getProviderName().getDisplayName());
        return currentProvider();
    }

    RetryPolicy resolvePolicy(RetryPolicyRequest policyOverride) {
        RetryPolicy defaults = properties.getRetry().toPolicy();
        return policyOverride != null ? policyOverride.applyTo(defaults) : defaults;
    }

    private void recordOutcome(ProviderName provider, MessageResult result) {
        boolean deadLettered = provider.dlqDisplayName().equals(result.provider());
        if (deadLettered && result.isSuccess()) {
            metricsService.recordDlq(provider);
            metricsService.recordFailed(provider);
        } else if (result.isSuccess()) {
            metricsService.recordSent(provider);
        } else {
            metricsService.recordFailed(provider);
        }
    }

    private Message toMessage(SendMessageRequest request) {
        byte[] payload;
        try {
            payload = objectMapper.writeValueAsBytes(request.getPayload());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload cannot be serialized: " + e.getOriginalMessage(), e);
        }
        return Message.builder(request.getTopic(), payload)
            .correlationId(request.getCorrelationId())
            .headers(request.getHeaders())
            .build();
    }

    private ProviderName currentProviderName() {
        return orchestrator.getCurrentAdapter().getProviderName();
    }

    /**
     * Callers close the returned signal so its deadline timer does not outlive the request.
     */
    private CancellationSignal requestSignal() {
        return CancellationSignal.withTimeout(properties.getDispatch().getRequestTimeout());
    }

    private List<String> availableProviders() {
        return adapterRegistry.availableProviders().stream()
            .map(ProviderName::toConfigValue)
            .toList();
    }
}
