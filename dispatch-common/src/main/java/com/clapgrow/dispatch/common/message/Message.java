package com.clapgrow.dispatch.common.message;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One unit of work to deliver through a {@link com.clapgrow.dispatch.common.provider.MessageAdapter}.
 *
 * Everything except the retry counter is fixed at construction. The counter is bumped in place by
 * the dispatch orchestrator before each backoff wait, so the same instance records how many times
 * it has been retried.
 *
 * Example usage:
 * <pre>
 * Message message = Message.builder("orders.created", payloadBytes)
 *     .correlationId(requestId)
 *     .header("tenant", "acme")
 *     .build();
 * </pre>
 */
public final class Message {

    public static final String ORIGINAL_MESSAGE_ID_HEADER = "OriginalMessageId";
    public static final String RETRY_ATTEMPT_HEADER = "RetryAttempt";

    private final String id;
    private final String topic;
    private final byte[] payload;
    private final Map<String, String> headers;
    private final Instant createdAt;
    private final AtomicInteger retryCount;
    private final String correlationId;

    private Message(Builder builder) {
        if (builder.topic == null || builder.topic.trim().isEmpty()) {
            throw new IllegalArgumentException("Message topic cannot be null or empty");
        }
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.topic = builder.topic;
        this.payload = builder.payload != null ? builder.payload.clone() : new byte[0];
        this.headers = Collections.unmodifiableMap(new HashMap<>(builder.headers));
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.retryCount = new AtomicInteger(Math.max(0, builder.retryCount));
        this.correlationId = builder.correlationId != null && !builder.correlationId.trim().isEmpty()
            ? builder.correlationId
            : null;
    }

    public static Message of(String topic, byte[] payload) {
        return builder(topic, payload).build();
    }

    public static Message of(String topic, byte[] payload, String correlationId) {
        return builder(topic, payload).correlationId(correlationId).build();
    }

    public static Builder builder(String topic, byte[] payload) {
        return new Builder(topic, payload);
    }

    public String getId() {
        return id;
    }

    public String getTopic() {
        return topic;
    }

    /**
     * @return copy of the serialized payload
     */
    public byte[] getPayload() {
        return payload.clone();
    }

    public String payloadAsString() {
        return new String(payload, StandardCharsets.UTF_8);
    }

    /**
     * @return read-only view of the headers
     */
    public Map<String, String> getHeaders() {
        return headers;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public int getRetryCount() {
        return retryCount.get();
    }

    public String getCorrelationId() {
        return correlationId;
    }

    /**
     * Marks this exact instance as retried once more. The counter never goes down.
     *
     * @return the new retry count
     */
    public int incrementRetryCount() {
        return retryCount.incrementAndGet();
    }

    /**
     * Duplicates this message for an ad-hoc resend.
     *
     * The copy gets a fresh id and creation time, a retry count one higher than this message,
     * and two extra headers pointing back at this message. Topic, payload, correlation id and
     * the existing headers are carried over.
     *
     * The dispatch orchestrator does not call this; its retry loop resubmits the original instance.
     */
    public Message createRetryMessage() {
        int nextAttempt = retryCount.get() + 1;
        return builder(topic, payload)
            .correlationId(correlationId)
            .headers(headers)
            .header(ORIGINAL_MESSAGE_ID_HEADER, id)
            .header(RETRY_ATTEMPT_HEADER, String.valueOf(nextAttempt))
            .retryCount(nextAttempt)
            .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Message)) return false;
        return id.equals(((Message) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Message{id=" + id
            + ", topic=" + topic
            + ", payloadBytes=" + payload.length
            + ", headers=" + headers.keySet()
            + ", retryCount=" + retryCount.get()
            + ", correlationId=" + correlationId + "}";
    }

    public static final class Builder {
        private final String topic;
        private final byte[] payload;
        private final Map<String, String> headers = new HashMap<>();
        private String id;
        private String correlationId;
        private Instant createdAt;
        private int retryCount;

        private Builder(String topic, byte[] payload) {
            this.topic = topic;
            this.payload = payload;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder header(String key, String value) {
            Objects.requireNonNull(key, "header key");
            headers.put(key, value != null ? value : "");
            return this;
        }

        public Builder headers(Map<String, String> values) {
            if (values != null) {
                values.forEach(this::header);
            }
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Message build() {
            return new Message(this);
        }
    }
}
