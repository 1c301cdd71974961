package com.questrail.qotd.host;

import com.questrail.qotd.codec.QuoteCodec;
import com.questrail.qotd.codec.impl.CharsetQuoteCodec;
import com.questrail.qotd.internal.time.CancellationSignal;
import com.questrail.qotd.internal.time.SystemWallClock;
import com.questrail.qotd.internal.time.WallClock;
import com.questrail.qotd.observability.QotdErrorEvent;
import com.questrail.qotd.observability.QotdObservabilitySink;
import com.questrail.qotd.observability.QotdTransportEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * QotdHost
 * =============================================================================
 * Lifecycle and resources shared by {@code QotdServer} and {@code QotdClient}.
 *
 * <h2>Architectural Role</h2>
 * Both engines <strong>own</strong> a host instead of extending a common base
 * class. The host provides:
 * <ul>
 *   <li>the buffer pool and the codec built on top of it,</li>
 *   <li>the disposal signal handed to quote providers,</li>
 *   <li>the diagnostic sink, guarded so that a failing sink never breaks a
 *       request.</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * Settings change only through {@link #apply(QotdHostConfig)}, under the host
 * lock. {@link #dispose()} fires the disposal signal exactly once; further calls
 * are no-ops.
 */
public final class QotdHost {
    private static final Logger log = LoggerFactory.getLogger(QotdHost.class);

    private final String name;
    private final QuoteBufferPool pool;
    private final QotdObservabilitySink diagnostics;
    private final WallClock wallClock;
    private final CancellationSignal disposalSignal = new CancellationSignal();
    private final AtomicBoolean disposed = new AtomicBoolean();
    private final Object lock = new Object();

    private volatile QotdHostConfig config;
    private volatile QuoteCodec codec;

    public QotdHost(String name, QotdHostConfig config, QotdObservabilitySink sink) {
        this(name, config, sink, SystemWallClock.INSTANCE);
    }

    public QotdHost(String name, QotdHostConfig config, QotdObservabilitySink sink, WallClock wallClock) {
        this.name = Objects.requireNonNull(name, "name");
        this.config = Objects.requireNonNull(config, "config");
        this.diagnostics = new GuardedSink(Objects.requireNonNull(sink, "sink"));
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.pool = new QuoteBufferPool(config.maximumQuoteLength(), config.maximumPooledBuffers());
        this.codec = new CharsetQuoteCodec(config.charset(), pool, diagnostics);
    }

    /**
     * Apply new shared settings. A changed length bound clears the pool; a
     * changed charset replaces the codec. Requests already holding the previous
     * codec finish with it.
     */
    public void apply(QotdHostConfig newConfig) {
        Objects.requireNonNull(newConfig, "newConfig");
        synchronized (lock) {
            pool.setMaximumQuoteLength(newConfig.maximumQuoteLength());
            pool.setMaximumPooledBuffers(newConfig.maximumPooledBuffers());
            if (!newConfig.charset().equals(config.charset())) {
                codec = new CharsetQuoteCodec(newConfig.charset(), pool, diagnostics);
            }
            config = newConfig;
        }
    }

    public QotdHostConfig config() {
        return config;
    }

    public QuoteCodec codec() {
        return codec;
    }

    public QuoteBufferPool pool() {
        return pool;
    }

    /**
     * Rent a buffer sized for a settings snapshot taken earlier, which may no
     * longer match the live bound.
     */
    public byte[] rentBuffer(int length) {
        return pool.rent(length);
    }

    public void releaseBuffer(byte[] buffer) {
        pool.release(buffer);
    }

    /**
     * Signal cancelled when the host is disposed.
     */
    public CancellationSignal disposalSignal() {
        return disposalSignal;
    }

    public boolean isDisposed() {
        return disposed.get();
    }

    /**
     * Fire the disposal signal. Idempotent.
     *
     * @return {@code true} for the call that actually disposed the host
     */
    public boolean dispose() {
        if (!disposed.compareAndSet(false, true)) {
            return false;
        }
        try {
            disposalSignal.cancel();
        } catch (RuntimeException e) {
            reportError(QotdErrorEvent.Kind.UNEXPECTED, name + ": disposal callback failed", e);
        }
        return true;
    }

    /**
     * Diagnostic sink safe to call from any thread; exceptions thrown by the
     * configured sink are logged and dropped.
     */
    public QotdObservabilitySink diagnostics() {
        return diagnostics;
    }

    public void reportError(QotdErrorEvent.Kind kind, String message, Throwable cause) {
        diagnostics.onError(new QotdErrorEvent(wallClock.now(), kind, message, cause));
    }

    public void reportTransport(QotdTransportEvent event) {
        diagnostics.onTransportEvent(event);
    }

    public WallClock wallClock() {
        return wallClock;
    }

    public String name() {
        return name;
    }

    private static final class GuardedSink implements QotdObservabilitySink {
        private final QotdObservabilitySink delegate;

        private GuardedSink(QotdObservabilitySink delegate) {
            this.delegate = delegate;
        }

        @Override
        public void onTransportEvent(QotdTransportEvent event) {
            try {
                delegate.onTransportEvent(event);
            } catch (RuntimeException e) {
                log.warn("Observability sink failed on transport event {}", event, e);
            }
        }

        @Override
        public void onError(QotdErrorEvent event) {
            try {
                delegate.onError(event);
            } catch (RuntimeException e) {
                log.warn("Observability sink failed on error event {}: {}", event.kind(), event.message(), e);
            }
        }
    }
}
