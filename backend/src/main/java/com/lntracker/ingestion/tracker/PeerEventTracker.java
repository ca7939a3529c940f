package com.lntracker.ingestion.tracker;

import com.lntracker.domain.PeerEventRecord;
import com.lntracker.domain.RawEventRecord;
import com.lntracker.domain.TrackerCategory;
import com.lntracker.ingestion.adapter.lnd.LndPeerEvent;
import com.lntracker.ingestion.stream.StreamDispatcher;

/**
 * Live peer online/offline events, stored as received.
 */
public class PeerEventTracker extends RawEventTracker<LndPeerEvent> {

    public PeerEventTracker(TrackerContext context, StreamDispatcher<LndPeerEvent> dispatcher) {
        super(context, dispatcher);
    }

    @Override
    public TrackerCategory getCategory() {
        return TrackerCategory.PEER_EVENTS;
    }

    @Override
    protected RawEventRecord newRecord() {
        return new PeerEventRecord();
    }
}
