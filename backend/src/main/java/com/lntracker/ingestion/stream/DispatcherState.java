package com.lntracker.ingestion.stream;

public enum DispatcherState {
    /** No subscriber registered yet; the upstream is not opened. */
    NOT_SUBSCRIBED,
    /** At least one subscriber; waiting for the upstream to deliver its first item. */
    SUBSCRIBED_WAITING,
    RECEIVING,
    STOPPED
}
