package com.questrail.qotd.quotes;

import com.questrail.qotd.internal.time.CancellationSignal;

import java.net.InetAddress;
import java.util.concurrent.CompletionStage;

/**
 * QuoteProvider
 * -----------------------------------------------------------------------------
 * Supplies the quote a server sends in answer to one request.
 *
 * <p>The server calls this once per accepted connection or received datagram.
 * Implementations may complete the returned stage immediately (the server then
 * answers on the I/O thread) or later (the server continues on the channel's
 * event loop when the stage completes).</p>
 *
 * <p>A stage completing exceptionally, an exception thrown by this method, or
 * a {@code null} quote all mean: no response for that request. The server
 * reports failures as diagnostics and keeps listening.</p>
 */
@FunctionalInterface
public interface QuoteProvider
{
    /**
     * @param clientAddress address of the requesting peer
     * @param token         cancelled when the server shuts down
     * @return the quote, as text in the server's charset
     */
    CompletionStage<String> getQuote(InetAddress clientAddress, CancellationSignal token);
}
