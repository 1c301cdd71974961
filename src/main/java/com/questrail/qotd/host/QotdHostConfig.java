package com.questrail.qotd.host;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Settings shared by servers and clients: the quote charset and the buffer
 * pool bounds.
 *
 * <p>The protocol specifies ASCII. Any other charset only works if both ends
 * agree on it. Quote lengths above 512 bytes likewise only work with peers that
 * accept them.</p>
 */
public record QotdHostConfig(
    Charset charset,
    int maximumQuoteLength,
    int maximumPooledBuffers
) {
    public static final Charset DEFAULT_CHARSET = StandardCharsets.US_ASCII;
    public static final int DEFAULT_MAXIMUM_QUOTE_LENGTH = 512;
    public static final int DEFAULT_MAXIMUM_POOLED_BUFFERS = 16;

    public QotdHostConfig {
        Objects.requireNonNull(charset, "charset");
        if (!charset.canEncode()) {
            throw new IllegalArgumentException("charset cannot encode: " + charset);
        }
        QuoteBufferPool.requireValidQuoteLength(maximumQuoteLength);
        QuoteBufferPool.requireValidPooledCount(maximumPooledBuffers);
    }

    /**
     * US-ASCII, 512-byte quotes, 16 pooled buffers.
     */
    public static QotdHostConfig defaults() {
        return new QotdHostConfig(DEFAULT_CHARSET, DEFAULT_MAXIMUM_QUOTE_LENGTH, DEFAULT_MAXIMUM_POOLED_BUFFERS);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Charset charset = DEFAULT_CHARSET;
        private int maximumQuoteLength = DEFAULT_MAXIMUM_QUOTE_LENGTH;
        private int maximumPooledBuffers = DEFAULT_MAXIMUM_POOLED_BUFFERS;

        public Builder withCharset(Charset charset) {
            this.charset = charset;
            return this;
        }

        public Builder withMaximumQuoteLength(int maximumQuoteLength) {
            this.maximumQuoteLength = maximumQuoteLength;
            return this;
        }

        public Builder withMaximumPooledBuffers(int maximumPooledBuffers) {
            this.maximumPooledBuffers = maximumPooledBuffers;
            return this;
        }

        public QotdHostConfig build() {
            return new QotdHostConfig(charset, maximumQuoteLength, maximumPooledBuffers);
        }
    }
}
