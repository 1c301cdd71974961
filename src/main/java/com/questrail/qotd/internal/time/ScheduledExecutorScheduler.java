package com.questrail.qotd.internal.time;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * {@link MonotonicScheduler} backed by a {@link ScheduledExecutorService}.
 *
 * <p>The client hands its Netty {@code EventLoopGroup} (which is a
 * {@code ScheduledExecutorService}) to this class, so request timers fire on
 * the same threads that perform the request I/O.</p>
 *
 * <h2>Executor Ownership</h2>
 * <p>This class does <strong>not</strong> own the executor. Callers are
 * responsible for shutdown.</p>
 *
 * <h2>Precision</h2>
 * <p>Tasks may execute slightly after their deadline, but never before.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        // Past deadlines run immediately.
        long delayNanos;
        try {
            delayNanos = Math.max(0, Math.subtractExact(deadlineNanos, clock.nowNanos()));
        } catch (ArithmeticException overflow) {
            delayNanos = deadlineNanos > 0 ? Long.MAX_VALUE : 0;
        }

        ScheduledFuture<?> future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);
        return () -> future.cancel(false);
    }
}
