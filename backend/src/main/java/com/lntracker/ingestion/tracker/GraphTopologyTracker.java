package com.lntracker.ingestion.tracker;

import com.lntracker.domain.GraphUpdateRecord;
import com.lntracker.domain.RawEventRecord;
import com.lntracker.domain.TrackerCategory;
import com.lntracker.ingestion.adapter.lnd.LndGraphUpdate;
import com.lntracker.ingestion.stream.StreamDispatcher;

/**
 * Live channel graph topology updates, stored as received.
 */
public class GraphTopologyTracker extends RawEventTracker<LndGraphUpdate> {

    public GraphTopologyTracker(TrackerContext context, StreamDispatcher<LndGraphUpdate> dispatcher) {
        super(context, dispatcher);
    }

    @Override
    public TrackerCategory getCategory() {
        return TrackerCategory.GRAPH_UPDATES;
    }

    @Override
    protected RawEventRecord newRecord() {
        return new GraphUpdateRecord();
    }
}
