package com.lntracker.ingestion.stream;

/**
 * Raised when an upstream subscription ends without an error. Subscriptions are expected to
 * stay open, so a clean close is handled like a dropped connection.
 */
public class StreamClosedException extends RuntimeException {

    public StreamClosedException(String message) {
        super(message);
    }
}
