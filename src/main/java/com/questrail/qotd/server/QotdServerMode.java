package com.questrail.qotd.server;

/**
 * Which transports a {@link QotdServer} listens on.
 */
public enum QotdServerMode {
    /**
     * TCP only. After a connection is accepted the quote is written and the
     * connection is closed.
     */
    STREAM,

    /**
     * UDP only. Any datagram received is answered with one datagram holding the
     * quote, addressed to the sender.
     */
    DATAGRAM,

    /** Both TCP and UDP. */
    BOTH;

    public boolean streamEnabled() {
        return this != DATAGRAM;
    }

    public boolean datagramEnabled() {
        return this != STREAM;
    }
}
