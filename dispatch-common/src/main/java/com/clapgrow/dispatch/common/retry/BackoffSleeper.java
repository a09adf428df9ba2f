package com.clapgrow.dispatch.common.retry;

import com.clapgrow.dispatch.common.cancel.CancellationSignal;

import java.time.Duration;

/**
 * Waits out a backoff delay between retry attempts.
 *
 * Implementations must abort with {@link java.util.concurrent.CancellationException}
 * as soon as the signal is cancelled.
 */
@FunctionalInterface
public interface BackoffSleeper {

    BackoffSleeper SIGNAL_AWARE = (delay, signal) -> signal.sleep(delay);

    void sleep(Duration delay, CancellationSignal signal);
}
