package com.questrail.qotd.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing a non-fatal error or anomaly in a QOTD host.
 *
 * @param cause may be {@code null} when the anomaly has no underlying exception
 */
public record QotdErrorEvent(
    Instant timestamp,
    Kind kind,
    String message,
    Throwable cause
) {
    public QotdErrorEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    public enum Kind {
        /** The quote provider threw or completed exceptionally. */
        PROVIDER_FAILURE,
        /** A socket could not be bound, written or read. */
        TRANSPORT_FAILURE,
        /** The quote contains a character the active charset cannot represent. */
        ENCODING_FAILURE,
        /** The quote did not fit in the buffer and was cut short. */
        QUOTE_TRUNCATED,
        /** Received bytes are not valid in the active charset. */
        DECODING_FAILURE,
        /** Anything else caught by a listener. */
        UNEXPECTED
    }
}
