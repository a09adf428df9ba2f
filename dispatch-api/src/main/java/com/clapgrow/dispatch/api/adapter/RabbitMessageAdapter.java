package com.clapgrow.dispatch.api.adapter;

import com.clapgrow.dispatch.api.config.MessagingProperties;
import com.clapgrow.dispatch.common.cancel.CancellationSignal;
import com.clapgrow.dispatch.common.message.Message;
import com.clapgrow.dispatch.common.provider.ProviderName;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.MessageBuilder;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.core.ReturnedMessage;
import org.springframework.amqp.rabbit.connection.CorrelationData;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Date;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * RabbitMQ transport.
 *
 * Messages are published to the configured exchange with the topic as routing key; on the default
 * exchange that delivers straight to the queue named after the topic. A send only succeeds once the
 * broker confirms it, and a message the broker could not route is reported as a failure.
 * Dead-lettered messages go to {@code <topic><dlq-suffix>}.
 */
@Component
@ConditionalOnProperty(prefix = "messaging.rabbitmq", name = "enabled", havingValue = "true")
@Slf4j
public class RabbitMessageAdapter extends AbstractMessageAdapter {

    static final String RETRY_COUNT_HEADER = "RetryCount";
    static final String DLQ_REASON_HEADER = "DLQ-Reason";
    static final String ORIGINAL_QUEUE_HEADER = "Original-Queue";
    static final String ORIGINAL_MESSAGE_ID_HEADER = "Original-MessageId";

    private final RabbitTemplate rabbitTemplate;
    private final MessagingProperties.RabbitMq settings;

    public RabbitMessageAdapter(RabbitTemplate rabbitTemplate, MessagingProperties properties) {
        this.rabbitTemplate = rabbitTemplate;
        this.settings = properties.getRabbitmq();
    }

    @Override
    protected CompletableFuture<?> startSend(Message message) {
        return publish(message.getTopic(), toAmqpMessage(message, Map.of()));
    }

    @Override
    protected CompletableFuture<?> startDlqSend(Message message, String destination, String reason) {
        Map<String, String> dlqHeaders = Map.of(
            DLQ_REASON_HEADER, reason != null ? reason : "",
            ORIGINAL_QUEUE_HEADER, message.getTopic(),
            ORIGINAL_MESSAGE_ID_HEADER, message.getId());
        return publish(destination, toAmqpMessage(message, dlqHeaders));
    }

    @Override
    protected String dlqDestination(Message message) {
        return message.getTopic() + settings.getDlqSuffix();
    }

    @Override
    protected String failureLabel() {
        return "RabbitMQ";
    }

    /**
     * Healthy when a channel can be opened on the broker connection.
     */
    @Override
    public boolean healthCheck(CancellationSignal signal) {
        try {
            signal.throwIfCancelled();
            Boolean open = signal.await(CompletableFuture.supplyAsync(
                () -> rabbitTemplate.execute(channel -> channel.isOpen())));
            return Boolean.TRUE.equals(open);
        } catch (ExecutionException e) {
            log.warn("RabbitMQ health check failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return false;
        } catch (CancellationException e) {
            log.warn("RabbitMQ health check cancelled");
            return false;
        } catch (RuntimeException e) {
            log.error("RabbitMQ health check error: {}", e.getMessage(), e);
            return false;
        }
    }

    @Override
    public ProviderName getProviderName() {
        return ProviderName.RABBITMQ;
    }

    private CompletableFuture<?> publish(String routingKey, org.springframework.amqp.core.Message amqpMessage) {
        CorrelationData correlation = new CorrelationData();
        rabbitTemplate.send(settings.getExchange(), routingKey, amqpMessage, correlation);
        return correlation.getFuture().thenApply(confirm -> {
            if (!confirm.isAck()) {
                throw new AmqpException("Broker rejected message: " + confirm.getReason());
            }
            ReturnedMessage returned = correlation.getReturned();
            if (returned != null) {
                throw new AmqpException("Message unroutable to " + routingKey + ": "
                    + returned.getReplyCode() + " " + returned.getReplyText());
            }
            return confirm;
        });
    }

    private static org.springframework.amqp.core.Message toAmqpMessage(Message message, Map<String, String> extraHeaders) {
        MessageProperties properties = new MessageProperties();
        properties.setMessageId(message.getId());
        properties.setTimestamp(Date.from(message.getCreatedAt()));
        properties.setContentType(MessageProperties.CONTENT_TYPE_BYTES);
        if (message.getCorrelationId() != null) {
            properties.setCorrelationId(message.getCorrelationId());
        }
        message.getHeaders().forEach(properties::setHeader);
        properties.setHeader(RETRY_COUNT_HEADER, String.valueOf(message.getRetryCount()));
        extraHeaders.forEach(properties::setHeader);
        return MessageBuilder.withBody(message.getPayload())
            .andProperties(properties)
            .build();
    }
}
