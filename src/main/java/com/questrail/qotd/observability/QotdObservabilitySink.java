package com.questrail.qotd.observability;

/**
 * Receives the diagnostics of a QOTD server or client.
 *
 * <p>Every non-fatal failure of the engine (provider failures, transport errors,
 * encoding problems, truncated quotes) is reported here instead of being thrown.
 * Implementations can provide logging, metrics, or tracing. Implementations must
 * be thread-safe: events arrive from Netty event loop threads.</p>
 */
public interface QotdObservabilitySink {
    /**
     * Called when a listener is bound or closed, or a request is served.
     * @param event the transport event
     */
    void onTransportEvent(QotdTransportEvent event);

    /**
     * Called when a non-fatal error or anomaly occurs.
     * @param event the error event
     */
    void onError(QotdErrorEvent event);
}
