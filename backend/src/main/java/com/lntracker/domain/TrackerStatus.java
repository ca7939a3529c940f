package com.lntracker.domain;

public enum TrackerStatus {
    PRE_SYNC,
    RUNNING,
    /** Retry budget spent or fatal upstream error; restarted only with the process. */
    FAILED,
    STOPPED
}
