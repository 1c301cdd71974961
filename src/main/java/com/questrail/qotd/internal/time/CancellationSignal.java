package com.questrail.qotd.internal.time;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * CancellationSignal
 * =============================================================================
 * One-shot, thread-safe cancellation signal.
 *
 * <p>Used in two places:</p>
 * <ul>
 *   <li>as the disposal signal of a host, handed to the quote provider with
 *       every request so long-running lookups can stop when the server shuts
 *       down;</li>
 *   <li>as the per-call token a caller may pass to
 *       {@code QotdClient.requestQuote(...)}.</li>
 * </ul>
 *
 * <p>Callbacks registered with {@link #onCancel(Runnable)} run exactly once, on
 * the thread that calls {@link #cancel()}. Registering on an already cancelled
 * signal runs the callback immediately on the caller's thread.</p>
 */
public final class CancellationSignal {

    private static final CancellationSignal NONE = new CancellationSignal();

    private final Object lock = new Object();
    private final Set<Runnable> callbacks = new LinkedHashSet<>();
    private boolean cancelled;

    /**
     * A signal that is never cancelled by anyone who does not hold a reference
     * to it. Cancelling it is a no-op.
     */
    public static CancellationSignal none() {
        return NONE;
    }

    public boolean isCancelled() {
        synchronized (lock) {
            return cancelled;
        }
    }

    /**
     * Cancel the signal and run all registered callbacks.
     *
     * <p>If a callback throws, the remaining callbacks still run and the first
     * failure is rethrown afterwards with the others attached as suppressed.</p>
     *
     * @return {@code true} if this call cancelled the signal; {@code false} if it
     *         was already cancelled
     */
    public boolean cancel() {
        if (this == NONE) {
            return false;
        }

        Runnable[] toRun;
        synchronized (lock) {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            toRun = callbacks.toArray(new Runnable[0]);
            callbacks.clear();
        }

        RuntimeException failure = null;
        for (Runnable callback : toRun) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
        return true;
    }

    /**
     * Register a callback to run when the signal is cancelled.
     *
     * @return handle that detaches the callback; detaching after the callback ran
     *         returns {@code false}
     */
    public Cancellable onCancel(Runnable callback) {
        Objects.requireNonNull(callback, "callback");

        // Wrap so that the same Runnable can be registered twice independently.
        Runnable registration = callback::run;
        synchronized (lock) {
            if (!cancelled) {
                callbacks.add(registration);
                return () -> {
                    synchronized (lock) {
                        return callbacks.remove(registration);
                    }
                };
            }
        }

        callback.run();
        return () -> false;
    }
}
