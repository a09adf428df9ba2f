package com.clapgrow.dispatch.common.cancel;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Caller-owned cancellation signal threaded through every dispatch operation.
 *
 * Cancelling aborts in-flight backend calls awaited through {@link #await(Future)} and wakes any
 * pending {@link #sleep(Duration)}. Cancellation always surfaces as {@link CancellationException}.
 * Once cancelled a signal stays cancelled.
 *
 * A signal only holds callbacks for work that is still pending, so one long-lived signal can be
 * shared across any number of calls. Signals derived through {@link #withDeadline(Duration)} stay
 * linked to their parent and their deadline timer until they fire or are closed.
 *
 * Example usage:
 * <pre>
 * try (CancellationSignal signal = CancellationSignal.withTimeout(Duration.ofSeconds(30))) {
 *     MessageResult result = orchestrator.sendWithRetry(message, policy, signal);
 * }
 * </pre>
 */
public final class CancellationSignal implements AutoCloseable {

    private static final Registration RELEASED = () -> { };

    private static final ScheduledThreadPoolExecutor DEADLINES = newDeadlineScheduler();

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    // guarded by this
    private Runnable detach;

    private CancellationSignal() {
    }

    public static CancellationSignal create() {
        return new CancellationSignal();
    }

    /**
     * A signal nobody else holds. It can still be cancelled by the callee.
     */
    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    /**
     * Fresh signal that cancels itself once {@code timeout} has elapsed.
     */
    public static CancellationSignal withTimeout(Duration timeout) {
        return create().withDeadline(timeout);
    }

    /**
     * Derive a child signal cancelled when this one is cancelled or when {@code timeout} elapses,
     * whichever comes first. Cancelling the child does not touch this signal.
     *
     * Close the child once the work it guards is done to drop its link to this signal and its timer.
     */
    public CancellationSignal withDeadline(Duration timeout) {
        CancellationSignal child = new CancellationSignal();
        Registration parentLink = onCancel(child::cancel);
        long millis = Math.max(0, timeout.toMillis());
        ScheduledFuture<?> timer = DEADLINES.schedule(child::cancel, millis, TimeUnit.MILLISECONDS);
        child.attach(() -> {
            parentLink.close();
            timer.cancel(false);
        });
        return child;
    }

    public void cancel() {
        if (cancelled.getCount() == 0) {
            return;
        }
        synchronized (this) {
            if (cancelled.getCount() == 0) {
                return;
            }
            cancelled.countDown();
        }
        for (Runnable callback : callbacks) {
            callback.run();
        }
        callbacks.clear();
        close();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * @throws CancellationException if this signal has been cancelled
     */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("Dispatch cancelled");
        }
    }

    /**
     * Register cleanup to run on cancellation. Runs immediately when already cancelled.
     *
     * @return handle that unregisters the callback; close it once the guarded work has finished
     */
    public Registration onCancel(Runnable callback) {
        Runnable entry = () -> callback.run();
        synchronized (this) {
            if (!isCancelled()) {
                callbacks.add(entry);
                return () -> callbacks.remove(entry);
            }
        }
        callback.run();
        return RELEASED;
    }

    /**
     * Suspend the calling thread for {@code delay}, waking early if the signal fires.
     *
     * @throws CancellationException if cancelled before or during the wait, or if the thread is interrupted
     */
    public void sleep(Duration delay) {
        throwIfCancelled();
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            if (cancelled.await(delay.toNanos(), TimeUnit.NANOSECONDS)) {
                throw new CancellationException("Dispatch cancelled during backoff");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancellation = new CancellationException("Interrupted during backoff");
            cancellation.initCause(e);
            throw cancellation;
        }
    }

    /**
     * Block until {@code future} completes, cancelling it if this signal fires first.
     *
     * @throws ExecutionException    if the future completed exceptionally
     * @throws CancellationException if the signal fired, the future was cancelled or the thread was interrupted
     */
    public <T> T await(Future<T> future) throws ExecutionException {
        throwIfCancelled();
        try (Registration ignored = onCancel(() -> future.cancel(true))) {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            CancellationException cancellation = new CancellationException("Interrupted while awaiting backend");
            cancellation.initCause(e);
            throw cancellation;
        }
    }

    /**
     * Detach from the parent signal and drop the deadline timer without cancelling.
     * No-op for root signals and on repeated calls.
     */
    @Override
    public void close() {
        Runnable release;
        synchronized (this) {
            release = detach;
            detach = null;
        }
        if (release != null) {
            release.run();
        }
    }

    int pendingCallbacks() {
        return callbacks.size();
    }

    static int pendingDeadlines() {
        return DEADLINES.getQueue().size();
    }

    private void attach(Runnable release) {
        synchronized (this) {
            if (!isCancelled()) {
                detach = release;
                return;
            }
        }
        release.run();
    }

    private static ScheduledThreadPoolExecutor newDeadlineScheduler() {
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "dispatch-deadline");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    /**
     * Handle returned by {@link #onCancel(Runnable)}. Closing it is idempotent.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
