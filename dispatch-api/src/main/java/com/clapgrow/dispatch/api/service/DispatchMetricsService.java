package com.clapgrow.dispatch.api.service;

import com.clapgrow.dispatch.common.provider.ProviderName;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;

/**
 * Prometheus metrics for outbound dispatch.
 *
 * Tracks, per provider:
 * - Messages sent / failed / retried / dead-lettered
 * - Retry count histogram
 * - Failed health checks
 * - Send latency (retry backoff included)
 *
 * Metrics are exposed at /actuator/prometheus
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DispatchMetricsService {

    private static final String PROVIDER_TAG = "provider";

    private final MeterRegistry meterRegistry;

    private final Map<ProviderName, Counter> sentCounters = new EnumMap<>(ProviderName.class);
    private final Map<ProviderName, Counter> failedCounters = new EnumMap<>(ProviderName.class);
    private final Map<ProviderName, Counter> retriedCounters = new EnumMap<>(ProviderName.class);
    private final Map<ProviderName, Counter> dlqCounters = new EnumMap<>(ProviderName.class);
    private final Map<ProviderName, Counter> healthFailureCounters = new EnumMap<>(ProviderName.class);
    private final Map<ProviderName, DistributionSummary> retryCountHistograms = new EnumMap<>(ProviderName.class);
    private final Map<ProviderName, Timer> sendTimers = new EnumMap<>(ProviderName.class);

    @PostConstruct
    void init() {
        for (ProviderName provider : ProviderName.values()) {
            String tag = provider.toConfigValue();
            sentCounters.put(provider, Counter.builder("dispatch.messages.sent")
                .description("Messages accepted by the messaging backend")
                .tag(PROVIDER_TAG, tag)
                .register(meterRegistry));

            failedCounters.put(provider, Counter.builder("dispatch.messages.failed")
                .description("Messages whose delivery failed, dead-lettered ones included")
                .tag(PROVIDER_TAG, tag)
                .register(meterRegistry));

            retriedCounters.put(provider, Counter.builder("dispatch.messages.retried")
                .description("Messages that needed at least one retry")
                .tag(PROVIDER_TAG, tag)
                .register(meterRegistry));

            dlqCounters.put(provider, Counter.builder("dispatch.messages.dlq")
                .description("Messages handed to the dead-letter sink")
                .tag(PROVIDER_TAG, tag)
                .register(meterRegistry));

            healthFailureCounters.put(provider, Counter.builder("dispatch.health.failures")
                .description("Failed backend health checks")
                .tag(PROVIDER_TAG, tag)
                .register(meterRegistry));

            retryCountHistograms.put(provider, DistributionSummary.builder("dispatch.retry.count")
                .description("Distribution of retry counts per retried message")
                .tag(PROVIDER_TAG, tag)
                .publishPercentiles(0.5, 0.75, 0.95, 0.99)
                .register(meterRegistry));

            sendTimers.put(provider, Timer.builder("dispatch.send.latency")
                .description("Time from dispatch request to final outcome")
                .tag(PROVIDER_TAG, tag)
                .publishPercentiles(0.5, 0.75, 0.95, 0.99)
                .register(meterRegistry));
        }
        log.info("Initialized dispatch metrics for {} providers", ProviderName.values().length);
    }

    public void recordSent(ProviderName provider) {
        sentCounters.get(provider).increment();
    }

    public void recordFailed(ProviderName provider) {
        failedCounters.get(provider).increment();
    }

    public void recordRetried(ProviderName provider, int retryCount) {
        retriedCounters.get(provider).increment();
        retryCountHistograms.get(provider).record(retryCount);
    }

    public void recordDlq(ProviderName provider) {
        dlqCounters.get(provider).increment();
    }

    public void recordHealthFailure(ProviderName provider) {
        healthFailureCounters.get(provider).increment();
    }

    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordSendLatency(ProviderName provider, Timer.Sample sample) {
        sample.stop(sendTimers.get(provider));
    }
}
