package com.questrail.qotd.codec;

import java.util.Optional;

/**
 * QuoteCodec
 * -----------------------------------------------------------------------------
 * Converts quote text to the bytes written on the wire and back.
 *
 * <p>The codec is the only place that knows about the active charset. It never
 * throws for problems with the text it encodes; those are reported as
 * diagnostics and expressed through the return value.</p>
 */
public interface QuoteCodec
{
    /**
     * Encode a quote into a buffer rented from the host's pool.
     *
     * <p>If the encoded quote is longer than the buffer, the largest prefix of
     * whole characters that fits is kept and a truncation diagnostic is
     * reported. If the quote contains a character the charset cannot represent,
     * the buffer goes back to the pool, an encoding diagnostic is reported and
     * the result is empty: the caller must not send anything.</p>
     *
     * @return the encoded quote, whose buffer the caller must return to the pool
     *         once it has been written; or {@link Optional#empty()}
     */
    Optional<EncodedQuote> encode(String quote);

    /**
     * Decode {@code length} bytes at the start of {@code buffer}.
     *
     * @throws QuoteDecodeException if the bytes are not valid in the charset
     *         (a decoding diagnostic is reported first)
     */
    String decode(byte[] buffer, int length);
}
