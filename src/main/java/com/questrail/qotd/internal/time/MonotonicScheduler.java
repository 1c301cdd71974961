package com.questrail.qotd.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * One-shot timers, such as the client request timeout.
 *
 * <p>Deadlines are expressed in monotonic ticks, never in wall-clock instants.</p>
 */
public interface MonotonicScheduler
{
    /**
     * Run {@code task} once, at or after {@code deadlineNanos}.
     *
     * @param deadlineNanos tick from {@link MonotonicClock#nowNanos()}; past
     *                      deadlines run as soon as possible
     * @return handle that cancels the task if it has not run yet
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Run {@code task} once, {@code delay} after the current tick of {@code clock}.
     * Delays past the tick range saturate to {@link Long#MAX_VALUE}.
     *
     * @throws IllegalArgumentException if {@code delay} is negative
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative: " + delay);
        }
        Objects.requireNonNull(task, "task");

        long deadline;
        try {
            deadline = Math.addExact(clock.nowNanos(), delay.toNanos());
        } catch (ArithmeticException overflow) {
            deadline = Long.MAX_VALUE;
        }
        return scheduleAtNanos(deadline, task);
    }
}
