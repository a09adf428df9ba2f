package com.clapgrow.dispatch.api.adapter;

import com.clapgrow.dispatch.api.config.MessagingProperties;
import com.clapgrow.dispatch.common.cancel.CancellationSignal;
import com.clapgrow.dispatch.common.message.Message;
import com.clapgrow.dispatch.common.message.MessageResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.core.ReturnedMessage;
import org.springframework.amqp.rabbit.connection.CorrelationData;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RabbitMessageAdapterTest {

    @Mock
    private RabbitTemplate rabbitTemplate;

    private RabbitMessageAdapter adapter;
    private CancellationSignal signal;

    @BeforeEach
    void setUp() {
        adapter = new RabbitMessageAdapter(rabbitTemplate, new MessagingProperties());
        signal = CancellationSignal.create();
    }

    @Test
    void testSend_Confirmed_PublishesToTopicQueueWithProperties() {
        confirmWith(true, null);
        byte[] payload = {(byte) 0x89, 'P', 'N', 'G', (byte) 0xFF, 0x00};
        Message message = Message.builder("orders", payload)
            .correlationId("req-9")
            .header("tenant", "acme")
            .build();

        MessageResult result = adapter.send(message, signal);

        assertTrue(result.isSuccess());
        assertEquals("RabbitMQ", result.provider());
        assertEquals(message.getId(), result.messageId());

        org.springframework.amqp.core.Message sent = capturedMessage("", "orders");
        assertArrayEquals(payload, sent.getBody());
        MessageProperties properties = sent.getMessageProperties();
        assertEquals(message.getId(), properties.getMessageId());
        assertEquals("req-9", properties.getCorrelationId());
        assertEquals(MessageProperties.CONTENT_TYPE_BYTES, properties.getContentType());
        assertEquals("acme", properties.getHeader("tenant"));
        assertEquals("0", properties.getHeader(RabbitMessageAdapter.RETRY_COUNT_HEADER));
    }

    @Test
    void testSend_Nacked_ReturnsFailedResult() {
        confirmWith(false, "queue full");

        MessageResult result = adapter.send(Message.of("orders", bytes("{}")), signal);

        assertFalse(result.isSuccess());
        assertEquals("RabbitMQ", result.provider());
        assertTrue(result.errorMessage().startsWith("RabbitMQ send failed: Broker rejected message: queue full"));
    }

    @Test
    void testSend_Unroutable_ReturnsFailedResult() {
        doAnswer(invocation -> {
            CorrelationData correlation = invocation.getArgument(3);
            correlation.setReturned(new ReturnedMessage(
                invocation.getArgument(2), 312, "NO_ROUTE", invocation.getArgument(0), invocation.getArgument(1)));
            correlation.getFuture().complete(new CorrelationData.Confirm(true, null));
            return null;
        }).when(rabbitTemplate).send(anyString(), anyString(), any(org.springframework.amqp.core.Message.class),
            any(CorrelationData.class));

        MessageResult result = adapter.send(Message.of("missing", bytes("{}")), signal);

        assertFalse(result.isSuccess());
        assertTrue(result.errorMessage().contains("Message unroutable to missing: 312 NO_ROUTE"));
    }

    @Test
    void testSend_BrokerDown_ReturnsFailedResult() {
        doThrow(new AmqpConnectException(new ConnectException("Connection refused")))
            .when(rabbitTemplate).send(anyString(), anyString(), any(org.springframework.amqp.core.Message.class),
                any(CorrelationData.class));

        MessageResult result = adapter.send(Message.of("orders", bytes("{}")), signal);

        assertFalse(result.isSuccess());
        assertTrue(result.errorMessage().startsWith("RabbitMQ send failed:"));
        assertInstanceOf(AmqpConnectException.class, result.cause());
    }

    @Test
    void testSend_UnconfirmedWhenCancelled_ThrowsCancellation() {
        CancellationSignal deadline = CancellationSignal.withTimeout(Duration.ofMillis(50));

        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> assertThrows(CancellationException.class,
            () -> adapter.send(Message.of("orders", bytes("{}")), deadline)));
    }

    @Test
    void testSendToDlq_PublishesToDotDlqQueueWithReason() {
        confirmWith(true, null);
        Message message = Message.of("orders", bytes("{}"));

        MessageResult result = adapter.sendToDlq(message, "poison message", signal);

        assertTrue(result.isSuccess());
        assertEquals("RabbitMQ-DLQ", result.provider());
        MessageProperties properties = capturedMessage("", "orders.dlq").getMessageProperties();
        assertEquals("poison message", properties.getHeader(RabbitMessageAdapter.DLQ_REASON_HEADER));
        assertEquals("orders", properties.getHeader(RabbitMessageAdapter.ORIGINAL_QUEUE_HEADER));
        assertEquals(message.getId(), properties.getHeader(RabbitMessageAdapter.ORIGINAL_MESSAGE_ID_HEADER));
    }

    @Test
    void testSendToDlq_Nacked_ReportsDlqError() {
        confirmWith(false, "rejected");

        MessageResult result = adapter.sendToDlq(Message.of("orders", bytes("{}")), "poison", signal);

        assertFalse(result.isSuccess());
        assertEquals("RabbitMQ-DLQ", result.provider());
        assertTrue(result.errorMessage().startsWith("RabbitMQ DLQ send failed:"));
    }

    @Test
    void testSendBatch_OneResultPerMessage() {
        confirmWith(true, null);

        List<MessageResult> results = adapter.sendBatch(
            List.of(Message.of("a", bytes("1")), Message.of("b", bytes("2"))), signal);

        assertEquals(2, results.size());
        assertTrue(results.stream().allMatch(MessageResult::isSuccess));
    }

    @Test
    void testHealthCheck_ChannelOpen_Healthy() {
        when(rabbitTemplate.<Boolean>execute(any())).thenReturn(true);

        assertTrue(adapter.healthCheck(signal));
    }

    @Test
    void testHealthCheck_BrokerDown_Unhealthy() {
        when(rabbitTemplate.<Boolean>execute(any()))
            .thenThrow(new AmqpConnectException(new ConnectException("Connection refused")));

        assertFalse(adapter.healthCheck(signal));
    }

    @Test
    void testHealthCheck_Cancelled_UnhealthyWithoutBrokerCall() {
        signal.cancel();

        assertFalse(adapter.healthCheck(signal));
        verifyNoInteractions(rabbitTemplate);
    }

    private void confirmWith(boolean ack, String reason) {
        doAnswer(invocation -> {
            CorrelationData correlation = invocation.getArgument(3);
            correlation.getFuture().complete(new CorrelationData.Confirm(ack, reason));
            return null;
        }).when(rabbitTemplate).send(anyString(), anyString(), any(org.springframework.amqp.core.Message.class),
            any(CorrelationData.class));
    }

    private org.springframework.amqp.core.Message capturedMessage(String exchange, String routingKey) {
        ArgumentCaptor<org.springframework.amqp.core.Message> captor =
            ArgumentCaptor.forClass(org.springframework.amqp.core.Message.class);
        verify(rabbitTemplate).send(eq(exchange), eq(routingKey), captor.capture(), any(CorrelationData.class));
        return captor.getValue();
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
