package com.clapgrow.dispatch.api.adapter;

import com.clapgrow.dispatch.api.config.MessagingProperties;
import com.clapgrow.dispatch.common.cancel.CancellationSignal;
import com.clapgrow.dispatch.common.message.Message;
import com.clapgrow.dispatch.common.provider.ProviderName;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.DescribeClusterOptions;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.Node;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Kafka transport.
 *
 * Records are keyed by correlation id (falling back to the message id) so related messages land on
 * the same partition. Dead-lettered records go to {@code <topic><dlq-suffix>} keyed by message id.
 */
@Component
@ConditionalOnProperty(prefix = "messaging.kafka", name = "enabled", havingValue = "true")
@Slf4j
public class KafkaMessageAdapter extends AbstractMessageAdapter {

    static final String MESSAGE_ID_HEADER = "MessageId";
    static final String CREATED_AT_HEADER = "CreatedAt";
    static final String RETRY_COUNT_HEADER = "RetryCount";
    static final String CORRELATION_ID_HEADER = "CorrelationId";
    static final String DLQ_REASON_HEADER = "DLQ-Reason";
    static final String ORIGINAL_TOPIC_HEADER = "Original-Topic";
    static final String ORIGINAL_MESSAGE_ID_HEADER = "Original-MessageId";

    private final KafkaTemplate<String, byte[]> kafkaTemplate;
    private final Admin admin;
    private final MessagingProperties.Kafka settings;

    public KafkaMessageAdapter(KafkaTemplate<String, byte[]> kafkaTemplate, Admin admin, MessagingProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.admin = admin;
        this.settings = properties.getKafka();
    }

    @Override
    protected CompletableFuture<?> startSend(Message message) {
        String key = message.getCorrelationId() != null ? message.getCorrelationId() : message.getId();
        ProducerRecord<String, byte[]> record = new ProducerRecord<>(message.getTopic(), key, message.getPayload());
        addEnvelopeHeaders(record, message);
        return kafkaTemplate.send(record);
    }

    @Override
    protected CompletableFuture<?> startDlqSend(Message message, String destination, String reason) {
        ProducerRecord<String, byte[]> record = new ProducerRecord<>(destination, message.getId(), message.getPayload());
        addEnvelopeHeaders(record, message);
        addHeader(record, DLQ_REASON_HEADER, reason != null ? reason : "");
        addHeader(record, ORIGINAL_TOPIC_HEADER, message.getTopic());
        addHeader(record, ORIGINAL_MESSAGE_ID_HEADER, message.getId());
        return kafkaTemplate.send(record);
    }

    @Override
    protected String dlqDestination(Message message) {
        return message.getTopic() + settings.getDlqSuffix();
    }

    @Override
    protected String failureLabel() {
        return "Kafka";
    }

    /**
     * Healthy when the cluster reports at least one broker within the configured timeout.
     */
    @Override
    public boolean healthCheck(CancellationSignal signal) {
        DescribeClusterOptions options = new DescribeClusterOptions()
            .timeoutMs((int) settings.getHealthTimeout().toMillis());
        try {
            signal.throwIfCancelled();
            Collection<Node> nodes = signal.await(admin.describeCluster(options).nodes());
            if (nodes.isEmpty()) {
                log.warn("Kafka health check: cluster reported no brokers");
                return false;
            }
            return true;
        } catch (ExecutionException e) {
            log.warn("Kafka health check failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return false;
        } catch (CancellationException e) {
            log.warn("Kafka health check cancelled");
            return false;
        } catch (RuntimeException e) {
            log.error("Kafka health check error: {}", e.getMessage(), e);
            return false;
        }
    }

    @Override
    public ProviderName getProviderName() {
        return ProviderName.KAFKA;
    }

    private static void addEnvelopeHeaders(ProducerRecord<String, byte[]> record, Message message) {
        message.getHeaders().forEach((name, value) -> addHeader(record, name, value));
        addHeader(record, MESSAGE_ID_HEADER, message.getId());
        addHeader(record, CREATED_AT_HEADER, message.getCreatedAt().toString());
        addHeader(record, RETRY_COUNT_HEADER, String.valueOf(message.getRetryCount()));
        if (message.getCorrelationId() != null) {
            addHeader(record, CORRELATION_ID_HEADER, message.getCorrelationId());
        }
    }

    private static void addHeader(ProducerRecord<String, byte[]> record, String name, String value) {
        record.headers().remove(name);
        record.headers().add(new RecordHeader(name, value.getBytes(StandardCharsets.UTF_8)));
    }
}
