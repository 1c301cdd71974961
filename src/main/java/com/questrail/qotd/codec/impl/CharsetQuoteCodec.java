package com.questrail.qotd.codec.impl;

import com.questrail.qotd.codec.EncodedQuote;
import com.questrail.qotd.codec.QuoteCodec;
import com.questrail.qotd.codec.QuoteDecodeException;
import com.questrail.qotd.host.QuoteBufferPool;
import com.questrail.qotd.internal.time.SystemWallClock;
import com.questrail.qotd.observability.QotdErrorEvent;
import com.questrail.qotd.observability.QotdObservabilitySink;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.util.Objects;
import java.util.Optional;

/**
 * CharsetQuoteCodec
 * =============================================================================
 * {@link QuoteCodec} backed by a {@link Charset} with strict error actions:
 * malformed or unmappable input is reported, never replaced.
 *
 * <p>Encoders and decoders are stateful, so a fresh one is created per call;
 * instances of this class are safe to share between event loop threads.</p>
 */
public final class CharsetQuoteCodec implements QuoteCodec {

    private final Charset charset;
    private final QuoteBufferPool pool;
    private final QotdObservabilitySink diagnostics;

    public CharsetQuoteCodec(Charset charset, QuoteBufferPool pool, QotdObservabilitySink diagnostics) {
        this.charset = Objects.requireNonNull(charset, "charset");
        this.pool = Objects.requireNonNull(pool, "pool");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public Charset charset() {
        return charset;
    }

    @Override
    public Optional<EncodedQuote> encode(String quote) {
        Objects.requireNonNull(quote, "quote");

        byte[] buffer = pool.rent();
        CharsetEncoder encoder = charset.newEncoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);

        ByteBuffer out = ByteBuffer.wrap(buffer);
        CoderResult result = encoder.encode(CharBuffer.wrap(quote), out, true);
        if (result.isError()) {
            pool.release(buffer);
            report(QotdErrorEvent.Kind.ENCODING_FAILURE,
                "Quote contains a character that cannot be encoded in " + charset.name());
            return Optional.empty();
        }

        // The encoder stops before a character that does not fit, so a
        // multi-byte sequence is never split; flush emits any trailing state.
        boolean truncated = result.isOverflow();
        if (encoder.flush(out).isOverflow()) {
            truncated = true;
        }

        if (truncated) {
            report(QotdErrorEvent.Kind.QUOTE_TRUNCATED,
                "Quote is longer than " + buffer.length + " bytes and was truncated");
        }
        return Optional.of(new EncodedQuote(buffer, out.position()));
    }

    @Override
    public String decode(byte[] buffer, int length) {
        Objects.requireNonNull(buffer, "buffer");
        Objects.checkFromIndexSize(0, length, buffer.length);

        try {
            return charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(buffer, 0, length))
                .toString();
        } catch (CharacterCodingException e) {
            String message = "Received quote contains bytes that are not valid " + charset.name();
            report(QotdErrorEvent.Kind.DECODING_FAILURE, message);
            throw new QuoteDecodeException(message, e);
        }
    }

    private void report(QotdErrorEvent.Kind kind, String message) {
        diagnostics.onError(new QotdErrorEvent(SystemWallClock.INSTANCE.now(), kind, message, null));
    }
}
