package com.questrail.qotd.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of QotdObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jQotdObservabilitySink implements QotdObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jQotdObservabilitySink.class);

    @Override
    public void onTransportEvent(QotdTransportEvent event) {
        if (event instanceof QotdTransportEvent.ListenerBound bound) {
            log.info("QOTD {} listener bound on {}", bound.protocol(), bound.localAddress());
        } else if (event instanceof QotdTransportEvent.ListenerClosed closed) {
            log.info("QOTD {} listener closed on {}", closed.protocol(), closed.localAddress());
        } else if (event instanceof QotdTransportEvent.RequestReceived received) {
            log.trace("QOTD {} request from {}", received.protocol(), received.remoteAddress());
        } else if (event instanceof QotdTransportEvent.ResponseSent sent) {
            log.debug("QOTD {} response of {} bytes sent to {}",
                sent.protocol(), sent.byteCount(), sent.remoteAddress());
        }
    }

    @Override
    public void onError(QotdErrorEvent event) {
        if (event.kind() == QotdErrorEvent.Kind.QUOTE_TRUNCATED) {
            log.warn("QOTD {}: {}", event.kind(), event.message());
            return;
        }
        log.error("QOTD {}: {}", event.kind(), event.message(), event.cause());
    }
}
