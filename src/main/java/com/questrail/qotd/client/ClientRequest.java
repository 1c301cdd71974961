package com.questrail.qotd.client;

import com.questrail.qotd.internal.time.Cancellable;

import io.netty.channel.Channel;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State of one outstanding client request.
 *
 * <p>The first of these wins and completes {@link #result()}:</p>
 * <ul>
 *   <li>a decoded quote ({@link #succeed(String)}),</li>
 *   <li>a transport or protocol failure ({@link #fail(Throwable)}),</li>
 *   <li>cancellation by timeout, token or client disposal ({@link #abort()}).</li>
 * </ul>
 * Whatever wins, the channel is closed and every registered timer and callback
 * is detached.
 */
final class ClientRequest {
    private final CompletableFuture<String> result = new CompletableFuture<>();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Cancellable> registrations = new ArrayList<>();

    private volatile Channel channel;

    CompletableFuture<String> result() {
        return result;
    }

    boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Track a timer or callback registration to detach once the request ends.
     * Only called by the issuing thread before any I/O starts.
     */
    void register(Cancellable registration) {
        registrations.add(registration);
    }

    /**
     * Bind the request to its channel. A request that already ended closes the
     * channel right away.
     */
    void attach(Channel channel) {
        this.channel = channel;
        if (result.isDone()) {
            channel.close();
        }
    }

    void succeed(String quote) {
        result.complete(quote);
    }

    void fail(Throwable cause) {
        result.completeExceptionally(cause);
    }

    void abort() {
        if (cancelled.compareAndSet(false, true)) {
            result.completeExceptionally(new CancellationException("QOTD request cancelled"));
            closeChannel();
        }
    }

    /** Detach registrations and close the channel. */
    void release() {
        for (Cancellable registration : registrations) {
            registration.cancel();
        }
        closeChannel();
    }

    private void closeChannel() {
        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }
    }
}
