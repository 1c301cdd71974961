package com.questrail.qotd.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used for event timestamps and for deciding which calendar
 * day a quote belongs to.
 *
 * <p>This clock may jump due to DST, NTP adjustments, or explicit time setting.
 * It must not be used for timeouts.</p>
 */
public interface WallClock
{
    Instant now();
}
