package com.lntracker.ingestion.tracker;

import com.lntracker.domain.ChannelEventRecord;
import com.lntracker.domain.RawEventRecord;
import com.lntracker.domain.TrackerCategory;
import com.lntracker.ingestion.adapter.lnd.LndChannelEvent;
import com.lntracker.ingestion.stream.StreamDispatcher;

/**
 * Live channel events, stored as received.
 */
public class ChannelEventTracker extends RawEventTracker<LndChannelEvent> {

    public ChannelEventTracker(TrackerContext context, StreamDispatcher<LndChannelEvent> dispatcher) {
        super(context, dispatcher);
    }

    @Override
    public TrackerCategory getCategory() {
        return TrackerCategory.CHANNEL_EVENTS;
    }

    @Override
    protected RawEventRecord newRecord() {
        return new ChannelEventRecord();
    }

    @Override
    protected boolean isStoreEnabled() {
        return context.properties().isStoreChannelEvents();
    }
}
