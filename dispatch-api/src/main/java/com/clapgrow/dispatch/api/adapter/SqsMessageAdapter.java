package com.clapgrow.dispatch.api.adapter;

import com.clapgrow.dispatch.api.config.MessagingProperties;
import com.clapgrow.dispatch.common.cancel.CancellationSignal;
import com.clapgrow.dispatch.common.message.Message;
import com.clapgrow.dispatch.common.provider.ProviderName;
import io.awspring.cloud.sqs.operations.SqsAsyncOperations;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.ListQueuesRequest;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Amazon SQS transport.
 *
 * The message topic is used as the queue name. Message headers travel as SQS message attributes.
 * SQS bodies are text, so a payload that is valid UTF-8 made only of characters SQS accepts is sent
 * as-is; any other payload is Base64-encoded and flagged with a
 * {@code Content-Transfer-Encoding: base64} attribute so consumers get the original bytes back.
 */
@Component
@ConditionalOnProperty(prefix = "messaging.sqs", name = "enabled", havingValue = "true")
@Slf4j
public class SqsMessageAdapter extends AbstractMessageAdapter {

    static final String MESSAGE_ID_HEADER = "MessageId";
    static final String CREATED_AT_HEADER = "CreatedAt";
    static final String RETRY_COUNT_HEADER = "RetryCount";
    static final String CORRELATION_ID_HEADER = "CorrelationId";
    static final String DLQ_REASON_HEADER = "DLQ-Reason";
    static final String ORIGINAL_QUEUE_HEADER = "Original-Queue";
    static final String ORIGINAL_MESSAGE_ID_HEADER = "Original-MessageId";
    static final String CONTENT_TRANSFER_ENCODING_HEADER = "Content-Transfer-Encoding";
    static final String BASE64_ENCODING = "base64";

    private final SqsAsyncOperations sqsOperations;
    private final SqsAsyncClient sqsAsyncClient;
    private final MessagingProperties.Sqs settings;

    public SqsMessageAdapter(SqsAsyncOperations sqsOperations, SqsAsyncClient sqsAsyncClient,
                             MessagingProperties properties) {
        this.sqsOperations = sqsOperations;
        this.sqsAsyncClient = sqsAsyncClient;
        this.settings = properties.getSqs();
    }

    @Override
    protected CompletableFuture<?> startSend(Message message) {
        Map<String, Object> headers = envelopeHeaders(message);
        String body = encodeBody(message, headers);
        return sqsOperations.<String>sendAsync(to -> to
            .queue(message.getTopic())
            .payload(body)
            .headers(headers));
    }

    @Override
    protected CompletableFuture<?> startDlqSend(Message message, String destination, String reason) {
        Map<String, Object> headers = envelopeHeaders(message);
        headers.put(DLQ_REASON_HEADER, reason != null ? reason : "");
        headers.put(ORIGINAL_QUEUE_HEADER, message.getTopic());
        headers.put(ORIGINAL_MESSAGE_ID_HEADER, message.getId());
        String body = encodeBody(message, headers);
        return sqsOperations.<String>sendAsync(to -> to
            .queue(destination)
            .payload(body)
            .headers(headers));
    }

    @Override
    protected String dlqDestination(Message message) {
        return message.getTopic() + settings.getDlqSuffix();
    }

    @Override
    protected String failureLabel() {
        return "SQS";
    }

    /**
     * Healthy when the queue listing call succeeds; credentials and region are exercised, no queue is required.
     */
    @Override
    public boolean healthCheck(CancellationSignal signal) {
        try {
            signal.throwIfCancelled();
            signal.await(sqsAsyncClient.listQueues(ListQueuesRequest.builder().maxResults(1).build()));
            return true;
        } catch (ExecutionException e) {
            log.warn("SQS health check failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return false;
        } catch (CancellationException e) {
            log.warn("SQS health check cancelled");
            return false;
        } catch (RuntimeException e) {
            log.error("SQS health check error: {}", e.getMessage(), e);
            return false;
        }
    }

    @Override
    public ProviderName getProviderName() {
        return ProviderName.SQS;
    }

    /**
     * Text body for the payload, marking {@code headers} when the body had to be Base64-encoded.
     */
    static String encodeBody(Message message, Map<String, Object> headers) {
        byte[] payload = message.getPayload();
        headers.remove(CONTENT_TRANSFER_ENCODING_HEADER);
        String text = decodeStrictUtf8(payload);
        if (text != null && text.codePoints().allMatch(SqsMessageAdapter::isAllowedInBody)) {
            return text;
        }
        headers.put(CONTENT_TRANSFER_ENCODING_HEADER, BASE64_ENCODING);
        return Base64.getEncoder().encodeToString(payload);
    }

    private static String decodeStrictUtf8(byte[] payload) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(payload)).toString();
        } catch (CharacterCodingException e) {
            log.debug("Payload is not valid UTF-8, sending it Base64-encoded: {}", e.toString());
            return null;
        }
    }

    // #x9 | #xA | #xD | #x20 to #xD7FF | #xE000 to #xFFFD | #x10000 to #x10FFFF
    private static boolean isAllowedInBody(int codePoint) {
        return codePoint == 0x9 || codePoint == 0xA || codePoint == 0xD
            || (codePoint >= 0x20 && codePoint <= 0xD7FF)
            || (codePoint >= 0xE000 && codePoint <= 0xFFFD)
            || (codePoint >= 0x10000 && codePoint <= 0x10FFFF);
    }

    private static Map<String, Object> envelopeHeaders(Message message) {
        Map<String, Object> headers = new HashMap<>(message.getHeaders());
        headers.put(MESSAGE_ID_HEADER, message.getId());
        headers.put(CREATED_AT_HEADER, message.getCreatedAt().toString());
        headers.put(RETRY_COUNT_HEADER, String.valueOf(message.getRetryCount()));
        if (message.getCorrelationId() != null) {
            headers.put(CORRELATION_ID_HEADER, message.getCorrelationId());
        }
        return headers;
    }
}
