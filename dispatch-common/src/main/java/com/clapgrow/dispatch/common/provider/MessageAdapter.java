package com.clapgrow.dispatch.common.provider;

import com.clapgrow.dispatch.common.cancel.CancellationSignal;
import com.clapgrow.dispatch.common.message.Message;
import com.clapgrow.dispatch.common.message.MessageResult;

import java.util.List;

/**
 * Messaging transport adapter.
 *
 * Binds the transport-neutral send contract to one messaging backend (Kafka, SQS, RabbitMQ, ...).
 * Every implementation is interchangeable at runtime and may be swapped on the orchestrator
 * while other sends are in flight, so implementations must be thread-safe.
 *
 * Implementation guidelines:
 * - Report ordinary delivery failures as {@link MessageResult#failed}, never by throwing
 * - Throw {@link IllegalArgumentException} only for programmer errors such as a null message
 * - Let {@link java.util.concurrent.CancellationException} propagate when the signal fires
 * - Never log payload contents or credentials
 */
public interface MessageAdapter {

    /**
     * Attempt one delivery.
     *
     * @param message message to deliver
     * @param signal  aborts the in-flight backend call when cancelled
     * @return success or failure of this single attempt
     */
    MessageResult send(Message message, CancellationSignal signal);

    /**
     * Deliver several messages. Implementations may fan out concurrently; a failure of one
     * message must not abort its siblings.
     *
     * @return exactly one result per input message, order not guaranteed
     */
    List<MessageResult> sendBatch(List<Message> messages, CancellationSignal signal);

    /**
     * Hand a message to the backend's dead-letter sink.
     *
     * @param reason why the message is being dead-lettered, recorded alongside it
     * @return outcome of the dead-letter delivery itself, tagged with {@link ProviderName#dlqDisplayName()}
     */
    MessageResult sendToDlq(Message message, String reason, CancellationSignal signal);

    /**
     * Cheap liveness probe. Internal errors are reported as {@code false}, never thrown.
     */
    boolean healthCheck(CancellationSignal signal);

    /**
     * Get the provider name.
     *
     * @return ProviderName enum value
     */
    ProviderName getProviderName();
}
