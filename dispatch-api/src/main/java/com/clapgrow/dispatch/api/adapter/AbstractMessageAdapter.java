package com.clapgrow.dispatch.api.adapter;

import com.clapgrow.dispatch.common.cancel.CancellationSignal;
import com.clapgrow.dispatch.common.message.Message;
import com.clapgrow.dispatch.common.message.MessageResult;
import com.clapgrow.dispatch.common.provider.MessageAdapter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Base class for adapters backed by an asynchronous vendor client.
 *
 * Subclasses only start the backend call and hand back its future. This class awaits the future
 * under the caller's {@link CancellationSignal} and folds every backend failure into a failed
 * {@link MessageResult}, so cancellation is the only thing that escapes a send.
 *
 * Batch sends start every message before awaiting any of them.
 */
@Slf4j
public abstract class AbstractMessageAdapter implements MessageAdapter {

    /**
     * Start delivery of {@code message} to its topic or queue.
     */
    protected abstract CompletableFuture<?> startSend(Message message);

    /**
     * Start delivery of {@code message} to {@code destination}, recording {@code reason}.
     */
    protected abstract CompletableFuture<?> startDlqSend(Message message, String destination, String reason);

    /**
     * Dead-letter destination for a message's topic or queue.
     */
    protected abstract String dlqDestination(Message message);

    /**
     * Short backend label used as the prefix of failure messages, e.g. "Kafka".
     */
    protected abstract String failureLabel();

    @Override
    public MessageResult send(Message message, CancellationSignal signal) {
        requireMessage(message);
        signal.throwIfCancelled();
        return awaitSend(message, begin(() -> startSend(message)), signal);
    }

    @Override
    public List<MessageResult> sendBatch(List<Message> messages, CancellationSignal signal) {
        if (messages == null) {
            throw new IllegalArgumentException("Messages cannot be null");
        }
        messages.forEach(AbstractMessageAdapter::requireMessage);
        signal.throwIfCancelled();

        List<CompletableFuture<?>> inFlight = new ArrayList<>(messages.size());
        for (Message message : messages) {
            inFlight.add(begin(() -> startSend(message)));
        }
        List<MessageResult> results = new ArrayList<>(messages.size());
        try (CancellationSignal.Registration ignored =
                 signal.onCancel(() -> inFlight.forEach(future -> future.cancel(true)))) {
            for (int i = 0; i < messages.size(); i++) {
                results.add(awaitSend(messages.get(i), inFlight.get(i), signal));
            }
        }
        long failures = results.stream().filter(result -> !result.isSuccess()).count();
        log.debug("{} batch of {} messages finished with {} failures", failureLabel(), messages.size(), failures);
        return results;
    }

    @Override
    public MessageResult sendToDlq(Message message, String reason, CancellationSignal signal) {
        requireMessage(message);
        signal.throwIfCancelled();
        String destination = dlqDestination(message);
        String dlqProvider = getProviderName().dlqDisplayName();
        try {
            signal.await(begin(() -> startDlqSend(message, destination, reason)));
            log.warn("Message {} dead-lettered to {}: {}", message.getId(), destination, reason);
            return MessageResult.successful(message.getId(), dlqProvider);
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e);
            log.error("{} DLQ send failed for message {} to {}: {}",
                failureLabel(), message.getId(), destination, cause.getMessage(), cause);
            return MessageResult.failed(failureLabel() + " DLQ send failed: " + cause.getMessage(), cause, dlqProvider);
        }
    }

    private MessageResult awaitSend(Message message, CompletableFuture<?> future, CancellationSignal signal) {
        String provider = getProviderName().getDisplayName();
        try {
            signal.await(future);
            log.debug("Message {} delivered to {} via {}", message.getId(), message.getTopic(), provider);
            return MessageResult.successful(message.getId(), provider);
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e);
            log.warn("{} send failed for message {} to {}: {}",
                failureLabel(), message.getId(), message.getTopic(), cause.getMessage());
            return MessageResult.failed(failureLabel() + " send failed: " + cause.getMessage(), cause, provider);
        }
    }

    /**
     * Vendor clients may fail synchronously (serialization, metadata timeouts); such failures are
     * reported through the returned future like any other.
     */
    private static CompletableFuture<?> begin(Supplier<CompletableFuture<?>> starter) {
        try {
            return starter.get();
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    protected static void requireMessage(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }
    }
}
