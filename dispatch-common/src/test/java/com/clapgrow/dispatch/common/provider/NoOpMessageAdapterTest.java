package com.clapgrow.dispatch.common.provider;

import com.clapgrow.dispatch.common.cancel.CancellationSignal;
import com.clapgrow.dispatch.common.message.Message;
import com.clapgrow.dispatch.common.message.MessageResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

class NoOpMessageAdapterTest {

    private final NoOpMessageAdapter adapter = new NoOpMessageAdapter();
    private final CancellationSignal signal = CancellationSignal.create();

    @Test
    void testSend_AlwaysSucceeds() {
        Message message = Message.of("orders", new byte[]{1});

        MessageResult result = adapter.send(message, signal);

        assertTrue(result.isSuccess());
        assertEquals(message.getId(), result.messageId());
        assertEquals("No-Op (Development)", result.provider());
    }

    @Test
    void testSendToDlq_TaggedAsDlq() {
        MessageResult result = adapter.sendToDlq(Message.of("orders", new byte[]{1}), "poison", signal);

        assertTrue(result.isSuccess());
        assertEquals("No-Op (Development)-DLQ", result.provider());
    }

    @Test
    void testSendBatch_OneResultPerMessage() {
        List<MessageResult> results = adapter.sendBatch(
            List.of(Message.of("a", new byte[0]), Message.of("b", new byte[0])), signal);

        assertEquals(2, results.size());
    }

    @Test
    void testSend_NullMessage_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> adapter.send(null, signal));
    }

    @Test
    void testSend_CancelledSignal_Propagates() {
        signal.cancel();

        assertThrows(CancellationException.class, () -> adapter.send(Message.of("a", new byte[0]), signal));
    }

    @Test
    void testHealthCheck() {
        assertTrue(adapter.healthCheck(signal));
        assertEquals(ProviderName.NOOP, adapter.getProviderName());
    }
}
