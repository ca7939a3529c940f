package com.lntracker.ingestion.tracker;

import com.lntracker.common.CloseableIterator;
import com.lntracker.domain.RawEventRecord;
import com.lntracker.domain.TrackedRecord;
import com.lntracker.ingestion.adapter.lnd.LndRawEvent;
import com.lntracker.ingestion.stream.StreamDispatcher;
import org.bson.Document;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

/**
 * Live-only tracker that stores every stream message untransformed. There is no history
 * to pre-sync and nothing to reconcile against.
 *
 * @param <E> stream message type
 */
public abstract class RawEventTracker<E extends LndRawEvent> extends AbstractLndTracker {

    private final StreamDispatcher<E> dispatcher;

    protected RawEventTracker(TrackerContext context, StreamDispatcher<E> dispatcher) {
        super(context);
        this.dispatcher = dispatcher;
    }

    protected abstract RawEventRecord newRecord();

    /** When false the stream is still consumed but nothing is written. */
    protected boolean isStoreEnabled() {
        return true;
    }

    @Override
    protected CloseableIterator<TrackedRecord> preSyncSource() {
        return null;
    }

    @Override
    protected Supplier<CloseableIterator<TrackedRecord>> newStreamFactory() {
        return subscribe(dispatcher, this::convert, null);
    }

    private List<TrackedRecord> convert(E event, boolean reconRunning) {
        if (!isStoreEnabled()) {
            return List.of();
        }
        String nodeId = nodeId();
        String json = event.payload().toString();
        Instant receivedAt = context.clock().instant();
        RawEventRecord record = newRecord();
        record.setId(nodeId + ":" + receivedAt.toEpochMilli() + ":"
                + DigestUtils.md5DigestAsHex(json.getBytes(StandardCharsets.UTF_8)));
        record.setNodeId(nodeId);
        record.setType(event.type());
        record.setReceivedAt(receivedAt);
        record.setPayload(Document.parse(json));
        return List.of(record);
    }
}
