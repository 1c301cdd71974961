package com.questrail.qotd.codec;

/**
 * Indicates that received bytes could not be decoded into quote text with the
 * active charset.
 */
public final class QuoteDecodeException extends RuntimeException
{
    public QuoteDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
