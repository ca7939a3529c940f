package com.lntracker.ingestion.tracker;

import com.fasterxml.jackson.databind.JsonNode;
import com.lntracker.common.CloseableIterator;
import com.lntracker.domain.HtlcEventRecord;
import com.lntracker.domain.TrackedRecord;
import com.lntracker.domain.TrackerCategory;
import com.lntracker.ingestion.adapter.lnd.LndHtlcEvent;
import com.lntracker.ingestion.stream.StreamDispatcher;
import org.bson.Document;

import java.util.List;
import java.util.function.Supplier;

/**
 * Live HTLC events. lnd keeps no history of them, so there is neither pre-sync nor reconciliation.
 */
public class HtlcEventTracker extends AbstractLndTracker {

    private final StreamDispatcher<LndHtlcEvent> dispatcher;

    public HtlcEventTracker(TrackerContext context, StreamDispatcher<LndHtlcEvent> dispatcher) {
        super(context);
        this.dispatcher = dispatcher;
    }

    @Override
    public TrackerCategory getCategory() {
        return TrackerCategory.HTLC_EVENTS;
    }

    @Override
    protected CloseableIterator<TrackedRecord> preSyncSource() {
        return null;
    }

    @Override
    protected Supplier<CloseableIterator<TrackedRecord>> newStreamFactory() {
        return subscribe(dispatcher, this::convert, null);
    }

    private List<TrackedRecord> convert(LndHtlcEvent e, boolean reconRunning) {
        String kind = e.kind();
        if (!context.properties().isStoreHtlcEvents() || "SUBSCRIBED".equals(kind)) {
            return List.of();
        }
        String nodeId = nodeId();
        HtlcEventRecord record = new HtlcEventRecord();
        record.setId(HtlcEventRecord.idFor(nodeId, e.incomingChannelId(), e.incomingHtlcId(),
                e.outgoingChannelId(), e.outgoingHtlcId(), e.timestampNs(), kind));
        record.setNodeId(nodeId);
        record.setTimestampNs(e.timestampNs());
        record.setKind(kind);
        record.setEventType(e.eventType());
        record.setIncomingChannelId(e.incomingChannelId());
        record.setOutgoingChannelId(e.outgoingChannelId());
        record.setIncomingHtlcId(e.incomingHtlcId());
        record.setOutgoingHtlcId(e.outgoingHtlcId());
        JsonNode detail = e.detail();
        record.setDetail(detail != null && detail.isObject() ? Document.parse(detail.toString()) : null);
        record.setRecordedAt(context.clock().instant());
        return List.of(record);
    }
}
