package com.questrail.qotd.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Minimal cancellation handle for a scheduled task or a registered callback.
 *
 * <p>Returned by {@link MonotonicScheduler} for one-shot timers and by
 * {@link CancellationSignal#onCancel(Runnable)} for cancellation callbacks, so
 * that a request can detach both once it completes.</p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the task or detach the callback.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was previously cancelled.
     */
    boolean cancel();
}
