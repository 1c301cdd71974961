package com.questrail.qotd.codec;

import java.util.Objects;

/**
 * A quote encoded into a pooled buffer. Only the first {@code length} bytes of
 * {@code buffer} are meaningful.
 */
public record EncodedQuote(byte[] buffer, int length) {
    public EncodedQuote {
        Objects.requireNonNull(buffer, "buffer");
        if (length < 0 || length > buffer.length) {
            throw new IllegalArgumentException("length out of range: " + length);
        }
    }
}
