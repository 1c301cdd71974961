package com.questrail.qotd.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for request timeouts and drain deadlines.
 *
 * <p>Wall-clock time ({@code Instant.now()}) is only used for observability
 * timestamps and for choosing the daily quote; anything that measures elapsed
 * time goes through this interface.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Values are
     * only meaningful for elapsed time computations.
     */
    long nowNanos();
}
