package com.questrail.qotd.server;

/**
 * Lifecycle of a {@link QotdServer}.
 *
 * <pre>
 *   IDLE → LISTENING → DRAINING → DISPOSED
 *     └──────────────────┘
 * </pre>
 *
 * A server closed before it was started goes straight to draining.
 */
public enum QotdServerState {
    IDLE,
    LISTENING,
    DRAINING,
    DISPOSED
}
