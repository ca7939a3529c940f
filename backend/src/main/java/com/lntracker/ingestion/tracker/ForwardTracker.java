package com.lntracker.ingestion.tracker;

import com.lntracker.common.CloseableIterator;
import com.lntracker.domain.ForwardRecord;
import com.lntracker.domain.TrackedRecord;
import com.lntracker.domain.TrackerCategory;
import com.lntracker.ingestion.adapter.lnd.LndForwardingEvent;
import com.lntracker.ingestion.stream.ItemConverter;
import com.lntracker.ingestion.stream.StreamConverter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.Supplier;

/**
 * Stores forwarding history. lnd has no forward subscription, so the live path is a
 * paginator that keeps polling from the number of stored forwards.
 */
@Slf4j
public class ForwardTracker extends AbstractLndTracker {

    public ForwardTracker(TrackerContext context) {
        super(context);
    }

    @Override
    public TrackerCategory getCategory() {
        return TrackerCategory.FORWARDS;
    }

    @Override
    protected CloseableIterator<TrackedRecord> preSyncSource() {
        return readFrom(context.store().getCheckpoint(TrackerCategory.FORWARDS, nodeId()), false);
    }

    @Override
    protected Supplier<CloseableIterator<TrackedRecord>> newStreamFactory() {
        return () -> readFrom(context.store().getCheckpoint(TrackerCategory.FORWARDS, nodeId()), true);
    }

    private CloseableIterator<TrackedRecord> readFrom(long offset, boolean tail) {
        log.debug("Reading forwards from offset {} for {}{}", offset, nodeId(), tail ? " (tailing)" : "");
        ItemConverter<LndForwardingEvent, TrackedRecord> converter = skipFailures(this::convert);
        return new StreamConverter<>(
                context.node().forwards().request(null, tail ? context.properties().getForwardPollInterval() : null, offset),
                f -> converter.convert(f, false));
    }

    private List<TrackedRecord> convert(LndForwardingEvent f, boolean reconRunning) {
        String nodeId = nodeId();
        ForwardRecord record = new ForwardRecord();
        record.setId(ForwardRecord.idFor(nodeId, f.timestampNs(), f.chanIdIn(), f.chanIdOut()));
        record.setNodeId(nodeId);
        record.setTimestampNs(f.timestampNs());
        record.setChanIdIn(f.chanIdIn());
        record.setChanIdOut(f.chanIdOut());
        record.setAmtInMsat(f.amtInMsat());
        record.setAmtOutMsat(f.amtOutMsat());
        record.setFeeMsat(f.feeMsat());
        record.setRecordedAt(context.clock().instant());
        return List.of(record);
    }
}
