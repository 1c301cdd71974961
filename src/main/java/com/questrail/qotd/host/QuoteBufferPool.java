package com.questrail.qotd.host;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * QuoteBufferPool
 * =============================================================================
 * Bounded LIFO pool of fixed-size byte arrays used to encode outgoing quotes and
 * to receive incoming ones.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>Every buffer handed out by {@link #rent()} is exactly
 *       {@link #maximumQuoteLength()} bytes long at the time it is rented.</li>
 *   <li>Changing the length bound clears the pool, and a returned buffer whose
 *       length no longer matches the bound is discarded, so a buffer allocated
 *       under an old bound is never handed out again.</li>
 *   <li>The pool never holds more than {@link #maximumPooledBuffers()} buffers.</li>
 * </ul>
 *
 * <p>All operations serialize on one pool-wide lock and run in constant time
 * (trimming after lowering the pooled count excepted).</p>
 */
public final class QuoteBufferPool {

    /** Largest quote length a host accepts. */
    public static final int MAX_QUOTE_LENGTH_LIMIT = 0xFFFF;

    private final Object lock = new Object();
    private final Deque<byte[]> buffers = new ArrayDeque<>(4);

    private int maximumQuoteLength;
    private int maximumPooledBuffers;

    public QuoteBufferPool(int maximumQuoteLength, int maximumPooledBuffers) {
        this.maximumQuoteLength = requireValidQuoteLength(maximumQuoteLength);
        this.maximumPooledBuffers = requireValidPooledCount(maximumPooledBuffers);
    }

    /**
     * Take a buffer from the pool, or allocate a new one if the pool is empty.
     */
    public byte[] rent() {
        synchronized (lock) {
            byte[] buffer = buffers.pollFirst();
            return buffer != null ? buffer : new byte[maximumQuoteLength];
        }
    }

    /**
     * Take a buffer of exactly {@code length} bytes. Served from the pool when
     * {@code length} is the current bound; otherwise allocated fresh, and
     * dropped again on {@link #release(byte[])}.
     *
     * @throws IllegalArgumentException if the length is not in {@code 1..65535}
     */
    public byte[] rent(int length) {
        requireValidQuoteLength(length);
        synchronized (lock) {
            if (length == maximumQuoteLength) {
                byte[] buffer = buffers.pollFirst();
                if (buffer != null) {
                    return buffer;
                }
            }
        }
        return new byte[length];
    }

    /**
     * Return a buffer to the pool. Dropped if the pool is full or the buffer was
     * sized for a previous length bound.
     */
    public void release(byte[] buffer) {
        if (buffer == null) {
            return;
        }
        synchronized (lock) {
            if (buffer.length == maximumQuoteLength && buffers.size() < maximumPooledBuffers) {
                buffers.offerFirst(buffer);
            }
        }
    }

    public int maximumQuoteLength() {
        synchronized (lock) {
            return maximumQuoteLength;
        }
    }

    /**
     * Change the length of buffers handed out from now on. Clears the pool when
     * the value changes.
     *
     * @throws IllegalArgumentException if the length is not in {@code 1..65535}
     */
    public void setMaximumQuoteLength(int maximumQuoteLength) {
        requireValidQuoteLength(maximumQuoteLength);
        synchronized (lock) {
            if (this.maximumQuoteLength != maximumQuoteLength) {
                this.maximumQuoteLength = maximumQuoteLength;
                buffers.clear();
            }
        }
    }

    public int maximumPooledBuffers() {
        synchronized (lock) {
            return maximumPooledBuffers;
        }
    }

    /**
     * @throws IllegalArgumentException if the count is negative
     */
    public void setMaximumPooledBuffers(int maximumPooledBuffers) {
        requireValidPooledCount(maximumPooledBuffers);
        synchronized (lock) {
            this.maximumPooledBuffers = maximumPooledBuffers;
            while (buffers.size() > maximumPooledBuffers) {
                buffers.pollLast();
            }
        }
    }

    /** Number of buffers currently idle in the pool. */
    public int pooledCount() {
        synchronized (lock) {
            return buffers.size();
        }
    }

    static int requireValidQuoteLength(int maximumQuoteLength) {
        if (maximumQuoteLength <= 0 || maximumQuoteLength > MAX_QUOTE_LENGTH_LIMIT) {
            throw new IllegalArgumentException(
                "maximumQuoteLength must be in 1.." + MAX_QUOTE_LENGTH_LIMIT + ": " + maximumQuoteLength);
        }
        return maximumQuoteLength;
    }

    static int requireValidPooledCount(int maximumPooledBuffers) {
        if (maximumPooledBuffers < 0) {
            throw new IllegalArgumentException("maximumPooledBuffers must be >= 0: " + maximumPooledBuffers);
        }
        return maximumPooledBuffers;
    }
}
