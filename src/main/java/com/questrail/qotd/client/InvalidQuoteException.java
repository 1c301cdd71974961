package com.questrail.qotd.client;

/**
 * The server answered, but the answer is not a quote: it was empty, or its bytes
 * are not valid in the configured charset.
 */
public final class InvalidQuoteException extends RuntimeException {
    public InvalidQuoteException(String message) {
        super(message);
    }

    public InvalidQuoteException(String message, Throwable cause) {
        super(message, cause);
    }
}
