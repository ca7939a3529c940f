package com.lntracker.ingestion.stream;

/**
 * Raised to a subscriber when its dispatcher stopped for good: the upstream failed fatally
 * or the retry budget ran out. The cause is the error that stopped the dispatcher.
 */
public class StreamTerminatedException extends RuntimeException {

    private final String dispatcherName;

    public StreamTerminatedException(String dispatcherName, Throwable cause) {
        super(dispatcherName + ": upstream stopped: " + cause.getMessage(), cause);
        this.dispatcherName = dispatcherName;
    }

    public String getDispatcherName() {
        return dispatcherName;
    }
}
