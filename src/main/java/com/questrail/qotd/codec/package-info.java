/**
 * QOTD Codec
 * =============================================================================
 *
 * <p>RFC 865 defines no framing: a quote is sent as raw character bytes, one
 * write per request, and the protocol recommends ASCII limited to 512
 * characters. This package converts between quote text and those bytes.</p>
 *
 * <pre>
 *   String quote
 *        → QuoteCodec.encode   (charset rules and length bound applied here)
 *            → EncodedQuote    (pooled buffer + byte count)
 *                → transport write
 * </pre>
 *
 * <h2>Failure policy</h2>
 * <ul>
 *   <li>Too long: truncate to the longest whole-character prefix, report, send.</li>
 *   <li>Unrepresentable character: report, send nothing.</li>
 *   <li>Undecodable bytes: report, throw {@link com.questrail.qotd.codec.QuoteDecodeException}.</li>
 * </ul>
 */
package com.questrail.qotd.codec;
