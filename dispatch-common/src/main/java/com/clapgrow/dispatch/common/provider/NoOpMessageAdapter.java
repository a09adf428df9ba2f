package com.clapgrow.dispatch.common.provider;

import com.clapgrow.dispatch.common.cancel.CancellationSignal;
import com.clapgrow.dispatch.common.message.Message;
import com.clapgrow.dispatch.common.message.MessageResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Simulated adapter bound when no real backend is configured.
 * Every operation succeeds and is only logged.
 */
@Slf4j
public class NoOpMessageAdapter implements MessageAdapter {

    @Override
    public MessageResult send(Message message, CancellationSignal signal) {
        requireMessage(message);
        signal.throwIfCancelled();
        log.info("[NoOp] Simulated send: messageId={}, topic={}, correlationId={}",
            message.getId(), message.getTopic(), message.getCorrelationId());
        return MessageResult.successful(message.getId(), getProviderName().getDisplayName());
    }

    @Override
    public List<MessageResult> sendBatch(List<Message> messages, CancellationSignal signal) {
        List<MessageResult> results = new ArrayList<>(messages.size());
        for (Message message : messages) {
            results.add(send(message, signal));
        }
        return results;
    }

    @Override
    public MessageResult sendToDlq(Message message, String reason, CancellationSignal signal) {
        requireMessage(message);
        signal.throwIfCancelled();
        log.warn("[NoOp] Simulated DLQ send: messageId={}, topic={}, reason={}",
            message.getId(), message.getTopic(), reason);
        return MessageResult.successful(message.getId(), getProviderName().dlqDisplayName());
    }

    @Override
    public boolean healthCheck(CancellationSignal signal) {
        return true;
    }

    @Override
    public ProviderName getProviderName() {
        return ProviderName.NOOP;
    }

    private static void requireMessage(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }
    }
}
