package com.lntracker.ingestion.tracker;

import com.lntracker.common.CancellationToken;
import com.lntracker.common.RetryPolicy;
import com.lntracker.ingestion.config.TrackerProperties;
import com.lntracker.ingestion.store.TrackerStore;

import java.time.Clock;

/**
 * Collaborators shared by every tracker of a node.
 */
public record TrackerContext(
        LndNode node,
        TrackerStore store,
        RetryPolicy retryPolicy,
        CancellationToken cancellationToken,
        TrackerProperties properties,
        Clock clock
) {
}
