package com.clapgrow.dispatch.common.dispatch;

import com.clapgrow.dispatch.common.cancel.CancellationSignal;
import com.clapgrow.dispatch.common.message.Message;
import com.clapgrow.dispatch.common.message.MessageResult;
import com.clapgrow.dispatch.common.provider.MessageAdapter;
import com.clapgrow.dispatch.common.retry.BackoffSleeper;
import com.clapgrow.dispatch.common.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Provider-agnostic dispatcher applying retry, backoff and dead-letter fallback around a
 * {@link MessageAdapter}.
 *
 * The only state shared between calls is the bound adapter, which may be swapped at any time via
 * {@link #setProvider(MessageAdapter)}. Retries run synchronously on the calling thread; the
 * backoff wait honours the caller's {@link CancellationSignal}.
 *
 * Outcome of {@link #sendWithRetry}:
 * - success on any attempt: that result, no further sends
 * - exhausted with DLQ enabled: the result of the dead-letter hand-off itself
 * - exhausted with DLQ disabled: a failed result summarising the exhaustion
 * - cancelled: {@link CancellationException}, never a result
 *
 * Every operation rejects a null message or signal with {@link IllegalArgumentException}; pass
 * {@link CancellationSignal#none()} when the caller has nothing to cancel with.
 */
public class DispatchOrchestrator {

    private final AtomicReference<MessageAdapter> adapter = new AtomicReference<>();
    private final Logger log;
    private final BackoffSleeper sleeper;

    public DispatchOrchestrator(MessageAdapter adapter) {
        this(adapter, LoggerFactory.getLogger(DispatchOrchestrator.class));
    }

    public DispatchOrchestrator(MessageAdapter adapter, Logger log) {
        this(adapter, log, BackoffSleeper.SIGNAL_AWARE);
    }

    public DispatchOrchestrator(MessageAdapter adapter, Logger log, BackoffSleeper sleeper) {
        if (log == null || sleeper == null) {
            throw new IllegalArgumentException("Logger and backoff sleeper cannot be null");
        }
        this.log = log;
        this.sleeper = sleeper;
        setProvider(adapter);
    }

    /**
     * Single attempt through the bound adapter, no retry.
     */
    public MessageResult send(Message message, CancellationSignal signal) {
        requireMessage(message);
        requireSignal(signal);
        MessageAdapter target = adapter.get();
        log.debug("Sending message {} to topic {} via {}",
            message.getId(), message.getTopic(), target.getProviderName().getDisplayName());
        return target.send(message, signal);
    }

    public List<MessageResult> sendBatch(List<Message> messages, CancellationSignal signal) {
        if (messages == null) {
            throw new IllegalArgumentException("Messages cannot be null");
        }
        requireSignal(signal);
        if (messages.isEmpty()) {
            return List.of();
        }
        MessageAdapter target = adapter.get();
        log.debug("Sending batch of {} messages via {}", messages.size(), target.getProviderName().getDisplayName());
        return target.sendBatch(messages, signal);
    }

    public MessageResult sendToDlq(Message message, String reason, CancellationSignal signal) {
        requireMessage(message);
        requireSignal(signal);
        MessageAdapter target = adapter.get();
        log.warn("Sending message {} from topic {} to DLQ via {}: {}",
            message.getId(), message.getTopic(), target.getProviderName().getDisplayName(), reason);
        return target.sendToDlq(message, reason, signal);
    }

    /**
     * @return false when the adapter reports unhealthy or the probe itself fails
     * @throws IllegalArgumentException if {@code signal} is null
     */
    public boolean healthCheck(CancellationSignal signal) {
        requireSignal(signal);
        MessageAdapter target = adapter.get();
        try {
            return target.healthCheck(signal);
        } catch (RuntimeException e) {
            log.error("Health check failed for {}: {}", target.getProviderName().getDisplayName(), e.getMessage(), e);
            return false;
        }
    }

    public MessageResult sendWithRetry(Message message, CancellationSignal signal) {
        return sendWithRetry(message, null, signal);
    }

    /**
     * Deliver with retry and dead-letter fallback.
     *
     * Attempts run from 0 to {@code policy.maxRetries()} inclusive against the adapter bound when
     * the call started. Before each backoff wait the message's retry counter is bumped in place and
     * the same instance is resubmitted.
     *
     * @param policy retry policy for this call, {@link RetryPolicy#defaults()} when null
     * @throws CancellationException if the signal fires during an attempt or a backoff wait
     */
    public MessageResult sendWithRetry(Message message, RetryPolicy policy, CancellationSignal signal) {
        requireMessage(message);
        requireSignal(signal);
        RetryPolicy effective = policy != null ? policy : RetryPolicy.defaults();
        MessageAdapter target = adapter.get();
        String providerName = target.getProviderName().getDisplayName();

        Throwable lastFault = null;
        for (int attempt = 0; attempt <= effective.maxRetries(); attempt++) {
            signal.throwIfCancelled();

            MessageResult result;
            try {
                result = target.send(message, signal);
            } catch (CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                result = MessageResult.failed(e.getMessage(), e, providerName);
            }

            if (result != null && result.isSuccess()) {
                if (attempt > 0) {
                    log.info("Message {} delivered via {} on attempt {}", message.getId(), providerName, attempt + 1);
                }
                return result;
            }

            lastFault = faultOf(result);

            if (attempt < effective.maxRetries()) {
                int retryCount = message.incrementRetryCount();
                Duration delay = computeDelay(effective, attempt);
                log.warn("Send of message {} to topic {} via {} failed (attempt {}/{}), retrying in {} ms: {}",
                    message.getId(), message.getTopic(), providerName, attempt + 1, effective.maxRetries() + 1,
                    delay.toMillis(), describe(lastFault));
                log.debug("Message {} retry count is now {}", message.getId(), retryCount);
                sleeper.sleep(delay, signal);
            }
        }

        String reason = String.format("Failed after %d retry attempts: %s",
            effective.maxRetries(), lastFault != null ? describe(lastFault) : "Unknown error");
        log.error("Message {} to topic {} exhausted retries via {}: {}",
            message.getId(), message.getTopic(), providerName, reason);

        if (!effective.sendToDlqOnExhaustion()) {
            return MessageResult.failed(reason, lastFault, providerName);
        }

        log.warn("Sending message {} to DLQ via {}", message.getId(), providerName);
        try {
            return target.sendToDlq(message, reason, signal);
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("DLQ hand-off for message {} failed: {}", message.getId(), e.getMessage(), e);
            return MessageResult.failed("DLQ send failed: " + e.getMessage(), e,
                target.getProviderName().dlqDisplayName());
        }
    }

    /**
     * Hot-swap the bound adapter. In-flight retry loops keep the adapter they started with.
     *
     * @throws IllegalArgumentException if {@code newAdapter} is null
     */
    public void setProvider(MessageAdapter newAdapter) {
        if (newAdapter == null) {
            throw new IllegalArgumentException("Message adapter cannot be null");
        }
        MessageAdapter previous = adapter.getAndSet(newAdapter);
        if (previous != null && previous != newAdapter) {
            log.info("Switched messaging provider from {} to {}",
                previous.getProviderName().getDisplayName(), newAdapter.getProviderName().getDisplayName());
        }
    }

    public String getCurrentProvider() {
        return adapter.get().getProviderName().getDisplayName();
    }

    public MessageAdapter getCurrentAdapter() {
        return adapter.get();
    }

    /**
     * Delay before the retry that follows the failed attempt {@code attempt} (zero-based).
     * Exponential delays saturate at {@code maxDelay}.
     */
    static Duration computeDelay(RetryPolicy policy, int attempt) {
        if (!policy.exponentialBackoff()) {
            return policy.baseDelay();
        }
        long baseMillis = policy.baseDelay().toMillis();
        long maxMillis = policy.maxDelay().toMillis();
        if (attempt >= 63 || baseMillis > (Long.MAX_VALUE >> attempt)) {
            return policy.maxDelay();
        }
        return Duration.ofMillis(Math.min(baseMillis << attempt, maxMillis));
    }

    private static Throwable faultOf(MessageResult result) {
        if (result == null) {
            return new MessageSendException("Adapter returned no result");
        }
        if (result.cause() != null) {
            return result.cause();
        }
        return new MessageSendException(result.errorMessage() != null ? result.errorMessage() : "Unknown error");
    }

    private static String describe(Throwable fault) {
        return fault.getMessage() != null ? fault.getMessage() : fault.getClass().getSimpleName();
    }

    private static void requireMessage(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }
    }

    private static void requireSignal(CancellationSignal signal) {
        if (signal == null) {
            throw new IllegalArgumentException("Cancellation signal cannot be null");
        }
    }
}
