package com.questrail.qotd.observability;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * QotdTransportEvent
 * -----------------------------------------------------------------------------
 * Lifecycle and traffic events of the transport layer. These carry no error
 * meaning; failures are reported as {@link QotdErrorEvent}.
 */
public sealed interface QotdTransportEvent
        permits QotdTransportEvent.ListenerBound, QotdTransportEvent.ListenerClosed,
                QotdTransportEvent.RequestReceived, QotdTransportEvent.ResponseSent
{
    Instant timestamp();

    /** The transport a listener or request uses. */
    enum Protocol { STREAM, DATAGRAM }

    /** A stream listener or datagram channel was bound. */
    record ListenerBound(Instant timestamp, Protocol protocol, SocketAddress localAddress)
            implements QotdTransportEvent {}

    /** A stream listener or datagram channel was closed. */
    record ListenerClosed(Instant timestamp, Protocol protocol, SocketAddress localAddress)
            implements QotdTransportEvent {}

    /** A connection was accepted or a request datagram arrived. */
    record RequestReceived(Instant timestamp, Protocol protocol, SocketAddress remoteAddress)
            implements QotdTransportEvent {}

    /** A quote was written to the remote peer. */
    record ResponseSent(Instant timestamp, Protocol protocol, SocketAddress remoteAddress, int byteCount)
            implements QotdTransportEvent {}
}
