package com.lntracker.ingestion.tracker;

import com.lntracker.domain.TrackerCategory;

/**
 * Ingestion pipeline for one event category of one node.
 */
public interface Tracker {

    TrackerCategory getCategory();

    /**
     * Reads history from the stored checkpoint and writes it in batches. Blocks until the
     * history is drained, {@link #preSyncStop()} is called, or the process is cancelled.
     */
    void preSyncStart();

    /** Makes a running pre-sync return after the current batch. */
    void preSyncStop();

    /**
     * Consumes the live stream and stores rows as they arrive. Blocks until cancelled.
     *
     * @throws TrackerException when the retry budget is spent
     */
    void start();
}
