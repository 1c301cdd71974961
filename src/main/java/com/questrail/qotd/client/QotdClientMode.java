package com.questrail.qotd.client;

/**
 * Transport used by a {@link QotdClient} for new requests.
 */
public enum QotdClientMode {
    /** Connect over TCP and read the quote until the server closes. */
    STREAM,
    /** Send one UDP datagram and wait for the single datagram answer. */
    DATAGRAM
}
