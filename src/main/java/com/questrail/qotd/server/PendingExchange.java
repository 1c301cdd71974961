package com.questrail.qotd.server;

import com.questrail.qotd.codec.EncodedQuote;
import com.questrail.qotd.codec.QuoteCodec;
import com.questrail.qotd.host.InFlightTracker;
import com.questrail.qotd.host.QotdHost;
import com.questrail.qotd.observability.QotdTransportEvent.Protocol;

import io.netty.channel.Channel;

import java.net.InetSocketAddress;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One request being answered: accepted connection or received datagram.
 *
 * <p>Created after the request was admitted by the server's
 * {@link InFlightTracker}. {@link #finish()} must be reached on every path; it
 * returns the encoded buffer to the pool, closes the connection (stream only)
 * and leaves the tracker, exactly once.</p>
 */
final class PendingExchange {
    private final Protocol protocol;
    private final Channel channel;
    private final InetSocketAddress remoteAddress;
    private final QuoteCodec codec;
    private final QotdHost host;
    private final InFlightTracker tracker;
    private final AtomicBoolean finished = new AtomicBoolean();

    private volatile EncodedQuote encoded;

    PendingExchange(Protocol protocol,
                    Channel channel,
                    InetSocketAddress remoteAddress,
                    QuoteCodec codec,
                    QotdHost host,
                    InFlightTracker tracker) {
        this.protocol = protocol;
        this.channel = channel;
        this.remoteAddress = remoteAddress;
        this.codec = codec;
        this.host = host;
        this.tracker = tracker;
    }

    Protocol protocol() {
        return protocol;
    }

    /**
     * Connection (stream) or listening channel (datagram) the answer goes out on.
     */
    Channel channel() {
        return channel;
    }

    InetSocketAddress remoteAddress() {
        return remoteAddress;
    }

    /**
     * Codec captured when the request arrived, so a concurrent charset change
     * does not affect this exchange.
     */
    QuoteCodec codec() {
        return codec;
    }

    void attach(EncodedQuote encoded) {
        this.encoded = encoded;
    }

    EncodedQuote encoded() {
        return encoded;
    }

    void finish() {
        if (!finished.compareAndSet(false, true)) {
            return;
        }
        try {
            EncodedQuote e = encoded;
            if (e != null) {
                host.releaseBuffer(e.buffer());
            }
            if (protocol == Protocol.STREAM) {
                channel.close();
            }
        } finally {
            tracker.exit();
        }
    }
}
