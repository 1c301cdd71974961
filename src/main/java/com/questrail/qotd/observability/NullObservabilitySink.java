package com.questrail.qotd.observability;

/**
 * No-op implementation of QotdObservabilitySink.
 */
public final class NullObservabilitySink implements QotdObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onTransportEvent(QotdTransportEvent event) {}

    @Override
    public void onError(QotdErrorEvent event) {}
}
