package com.lntracker.ingestion.stream;

import com.lntracker.common.CloseableIterator;

/**
 * Opens a fresh, finite backfill sequence of already converted rows. Called once per
 * reconciliation cycle, after the grace period.
 */
@FunctionalInterface
public interface ReconciliationSourceFactory<V> {

    CloseableIterator<V> open();
}
