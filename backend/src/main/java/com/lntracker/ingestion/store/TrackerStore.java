package com.lntracker.ingestion.store;

import com.lntracker.domain.TrackedRecord;
import com.lntracker.domain.TrackerCategory;

import java.util.Collection;

/**
 * Durable sink for tracker rows. Writes are upserts by document id: re-adding a row that is
 * already present neither duplicates it nor fails.
 */
public interface TrackerStore {

    /**
     * Position to resume pre-sync from: max payment index, max invoice add index, or the
     * number of stored forwards. 0 when nothing is stored for the node.
     */
    long getCheckpoint(TrackerCategory category, String nodeId);

    void addBatch(Collection<? extends TrackedRecord> rows);

    void addOne(TrackedRecord row);

    /**
     * Whether the payment or invoice with this index is stored. Only PAYMENTS and INVOICES are indexed.
     */
    boolean exists(TrackerCategory category, String nodeId, long index);
}
