package com.clapgrow.dispatch.common.cancel;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CancellationSignalTest {

    @Test
    void testCancel_IsIdempotentAndRunsCallbacksOnce() {
        CancellationSignal signal = CancellationSignal.create();
        AtomicInteger calls = new AtomicInteger();
        signal.onCancel(calls::incrementAndGet);

        signal.cancel();
        signal.cancel();

        assertTrue(signal.isCancelled());
        assertEquals(1, calls.get());
        assertThrows(CancellationException.class, signal::throwIfCancelled);
    }

    @Test
    void testOnCancel_AfterCancellation_RunsImmediately() {
        CancellationSignal signal = CancellationSignal.create();
        signal.cancel();
        AtomicInteger calls = new AtomicInteger();

        signal.onCancel(calls::incrementAndGet);

        assertEquals(1, calls.get());
    }

    @Test
    void testSleep_CompletesWhenNotCancelled() {
        CancellationSignal signal = CancellationSignal.none();

        assertDoesNotThrow(() -> signal.sleep(Duration.ofMillis(10)));
        assertDoesNotThrow(() -> signal.sleep(Duration.ZERO));
    }

    @Test
    void testSleep_WokenByCancellation() {
        CancellationSignal signal = CancellationSignal.create();
        CompletableFuture.delayedExecutor(30, TimeUnit.MILLISECONDS).execute(signal::cancel);

        assertTimeoutPreemptively(Duration.ofSeconds(5),
            () -> assertThrows(CancellationException.class, () -> signal.sleep(Duration.ofMinutes(10))));
    }

    @Test
    void testSleep_InterruptReportedAsCancellation() {
        CancellationSignal signal = CancellationSignal.create();
        Thread.currentThread().interrupt();

        assertThrows(CancellationException.class, () -> signal.sleep(Duration.ofSeconds(1)));
        assertTrue(Thread.interrupted());
    }

    @Test
    void testWithTimeout_CancelsAfterDeadline() {
        CancellationSignal signal = CancellationSignal.withTimeout(Duration.ofMillis(20));

        assertTimeoutPreemptively(Duration.ofSeconds(5),
            () -> assertThrows(CancellationException.class, () -> signal.sleep(Duration.ofMinutes(10))));
    }

    @Test
    void testWithDeadline_ParentCancellationPropagatesToChild() {
        CancellationSignal parent = CancellationSignal.create();
        CancellationSignal child = parent.withDeadline(Duration.ofMinutes(10));

        parent.cancel();

        assertTrue(child.isCancelled());
    }

    @Test
    void testWithDeadline_ChildCancellationLeavesParentAlone() {
        CancellationSignal parent = CancellationSignal.create();
        CancellationSignal child = parent.withDeadline(Duration.ofMinutes(10));

        child.cancel();

        assertFalse(parent.isCancelled());
    }

    @Test
    void testAwait_ReturnsCompletedValue() throws ExecutionException {
        CancellationSignal signal = CancellationSignal.create();

        assertEquals("ok", signal.await(CompletableFuture.completedFuture("ok")));
    }

    @Test
    void testAwait_FailedFuture_ThrowsExecutionException() {
        CancellationSignal signal = CancellationSignal.create();

        assertThrows(ExecutionException.class,
            () -> signal.await(CompletableFuture.failedFuture(new IllegalStateException("boom"))));
    }

    @Test
    void testAwait_CancellationAbortsPendingFuture() {
        CancellationSignal signal = CancellationSignal.create();
        CompletableFuture<String> pending = new CompletableFuture<>();
        CompletableFuture.delayedExecutor(30, TimeUnit.MILLISECONDS).execute(signal::cancel);

        assertTimeoutPreemptively(Duration.ofSeconds(5),
            () -> assertThrows(CancellationException.class, () -> signal.await(pending)));
        assertTrue(pending.isCancelled());
    }

    @Test
    void testAwait_CompletedFutures_ReleaseTheirCallbacks() throws ExecutionException {
        CancellationSignal signal = CancellationSignal.none();

        for (int i = 0; i < 10_000; i++) {
            signal.await(CompletableFuture.completedFuture(i));
        }

        assertEquals(0, signal.pendingCallbacks());
    }

    @Test
    void testAwait_FailedFuture_ReleasesItsCallback() {
        CancellationSignal signal = CancellationSignal.create();

        assertThrows(ExecutionException.class,
            () -> signal.await(CompletableFuture.failedFuture(new IllegalStateException("boom"))));

        assertEquals(0, signal.pendingCallbacks());
    }

    @Test
    void testOnCancel_ClosedRegistration_IsNotRun() {
        CancellationSignal signal = CancellationSignal.create();
        AtomicInteger calls = new AtomicInteger();
        CancellationSignal.Registration registration = signal.onCancel(calls::incrementAndGet);

        registration.close();
        registration.close();
        signal.cancel();

        assertEquals(0, calls.get());
    }

    @Test
    void testOnCancel_SameCallbackTwice_ClosingOneKeepsTheOther() {
        CancellationSignal signal = CancellationSignal.create();
        AtomicInteger calls = new AtomicInteger();
        Runnable callback = calls::incrementAndGet;
        CancellationSignal.Registration first = signal.onCancel(callback);
        signal.onCancel(callback);

        first.close();
        signal.cancel();

        assertEquals(1, calls.get());
    }

    @Test
    void testWithDeadline_ClosedChild_DetachesFromParent() {
        CancellationSignal parent = CancellationSignal.create();
        CancellationSignal child = parent.withDeadline(Duration.ofMinutes(10));
        assertEquals(1, parent.pendingCallbacks());

        child.close();
        parent.cancel();

        assertEquals(0, parent.pendingCallbacks());
        assertFalse(child.isCancelled());
    }

    @Test
    void testWithDeadline_CancelledChild_DetachesFromParent() {
        CancellationSignal parent = CancellationSignal.create();
        CancellationSignal child = parent.withDeadline(Duration.ofMinutes(10));

        child.cancel();

        assertEquals(0, parent.pendingCallbacks());
        assertFalse(parent.isCancelled());
    }

    @Test
    void testWithTimeout_Close_DropsDeadlineTimer() {
        int before = CancellationSignal.pendingDeadlines();
        CancellationSignal signal = CancellationSignal.withTimeout(Duration.ofMinutes(10));
        assertEquals(before + 1, CancellationSignal.pendingDeadlines());

        signal.close();

        assertEquals(before, CancellationSignal.pendingDeadlines());
        assertFalse(signal.isCancelled());
    }
}
