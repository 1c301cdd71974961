package com.questrail.qotd.host;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * InFlightTracker
 * =============================================================================
 * Counts requests that are currently being handled and lets shutdown and
 * reconfiguration wait, with a bound, for that count to reach zero.
 *
 * <p>Usage per request:</p>
 * <pre>
 *   if (!tracker.tryEnter()) { abandon; }
 *   try { ... } finally { tracker.exit(); }
 * </pre>
 *
 * <p>{@link #tryEnter()} increments first and re-checks the draining flag
 * afterwards, so a request that races with {@link #beginDraining()} is either
 * counted (and waited for) or refused; it is never missed.</p>
 *
 * <p>The wait is best-effort: {@link #awaitIdle(Duration)} returns {@code false}
 * on timeout and callers proceed anyway.</p>
 */
public final class InFlightTracker {

    private final AtomicInteger count = new AtomicInteger();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition idle = lock.newCondition();

    private volatile boolean draining;

    /**
     * Register a request.
     *
     * @return {@code false} if the tracker is draining; the request must then be
     *         abandoned without calling {@link #exit()}
     */
    public boolean tryEnter() {
        if (draining) {
            return false;
        }
        count.incrementAndGet();
        if (draining) {
            exit();
            return false;
        }
        return true;
    }

    /**
     * Unregister a request previously admitted by {@link #tryEnter()}.
     */
    public void exit() {
        int remaining = count.decrementAndGet();
        if (remaining < 0) {
            count.incrementAndGet();
            throw new IllegalStateException("exit() without matching tryEnter()");
        }
        if (remaining == 0) {
            lock.lock();
            try {
                idle.signalAll();
            } finally {
                lock.unlock();
            }
        }
    }

    /** Refuse new requests from now on. */
    public void beginDraining() {
        draining = true;
    }

    public boolean isDraining() {
        return draining;
    }

    public int count() {
        return count.get();
    }

    /**
     * Wait until no request is in flight.
     *
     * @return {@code true} if the count reached zero, {@code false} on timeout or
     *         interruption (the interrupt flag is restored)
     */
    public boolean awaitIdle(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");

        long remainingNanos = timeout.toNanos();
        lock.lock();
        try {
            while (count.get() > 0) {
                if (remainingNanos <= 0) {
                    return false;
                }
                remainingNanos = idle.awaitNanos(remainingNanos);
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            lock.unlock();
        }
    }
}
