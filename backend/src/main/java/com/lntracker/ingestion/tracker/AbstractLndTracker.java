package com.lntracker.ingestion.tracker;

import com.lntracker.common.CloseableIterator;
import com.lntracker.common.StreamProgressLogger;
import com.lntracker.domain.TrackedRecord;
import com.lntracker.domain.TrackerCategory;
import com.lntracker.ingestion.stream.ItemConverter;
import com.lntracker.ingestion.stream.ReconciliationSourceFactory;
import com.lntracker.ingestion.stream.StreamDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Shared pipeline of the lnd trackers.
 * <p>
 * Pre-sync drains history from the stored checkpoint in batches; the live path stores rows
 * one by one as they arrive. Both run inside the retry policy. A row that cannot be
 * converted is skipped; a failed write fails the attempt.
 */
@Slf4j
public abstract class AbstractLndTracker implements Tracker {

    protected final TrackerContext context;
    private final StreamProgressLogger progressLogger;
    private volatile boolean preSyncStopped;
    private Supplier<CloseableIterator<TrackedRecord>> streamFactory;

    protected AbstractLndTracker(TrackerContext context) {
        this.context = context;
        this.progressLogger = new StreamProgressLogger(log, getCategory().getItemsName(),
                context.properties().getProgressLogInterval());
    }

    /**
     * History to pre-sync, starting at the stored checkpoint.
     *
     * @return null when the category has no history to read
     */
    protected abstract CloseableIterator<TrackedRecord> preSyncSource();

    /**
     * Called once; every call of the returned factory opens a fresh live sequence.
     */
    protected abstract Supplier<CloseableIterator<TrackedRecord>> newStreamFactory();

    /**
     * Hook for removing rows left incomplete by an earlier run. Runs before each pre-sync.
     */
    protected void deleteOrphanedData() {
    }

    /** Clears in-memory progress after the tracker gave up. The stored checkpoint stays. */
    protected void resetState() {
    }

    @Override
    public void preSyncStart() {
        if (context.cancellationToken().isCancelled()) {
            return;
        }
        preSyncStopped = false;
        String itemsName = getCategory().getItemsName();
        log.info("Presync {}...", itemsName);
        boolean completed = runWithRetry("presync", () -> {
            deleteOrphanedData();
            writeHistory();
        });
        log.info("Presync {} {}", itemsName, completed ? "finished" : "cancelled");
    }

    @Override
    public void preSyncStop() {
        preSyncStopped = true;
    }

    @Override
    public void start() {
        if (context.cancellationToken().isCancelled()) {
            return;
        }
        Supplier<CloseableIterator<TrackedRecord>> factory = streamFactory();
        runWithRetry("stream", () -> storeStream(factory));
        log.info("{} stream ended", getCategory().getItemsName());
    }

    protected String nodeId() {
        return context.node().pubkey();
    }

    /**
     * Subscribes to {@code dispatcher} with conversion errors turned into skipped items.
     */
    protected <T> Supplier<CloseableIterator<TrackedRecord>> subscribe(StreamDispatcher<T> dispatcher,
                                                                        ItemConverter<T, TrackedRecord> converter,
                                                                        ReconciliationSourceFactory<TrackedRecord> reconciliation) {
        return dispatcher.subscribe(skipFailures(converter), reconciliation);
    }

    /**
     * Wraps {@code converter} so a failing item is logged and dropped. Store errors still propagate.
     */
    protected <T> ItemConverter<T, TrackedRecord> skipFailures(ItemConverter<T, TrackedRecord> converter) {
        return (item, reconRunning) -> {
            try {
                return converter.convert(item, reconRunning);
            } catch (DataAccessException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Skipping {} item that could not be converted: {}", getCategory().getItemsName(), item, e);
                return List.of();
            }
        };
    }

    private synchronized Supplier<CloseableIterator<TrackedRecord>> streamFactory() {
        if (streamFactory == null) {
            streamFactory = newStreamFactory();
        }
        return streamFactory;
    }

    private void writeHistory() {
        CloseableIterator<TrackedRecord> source = preSyncSource();
        if (source == null) {
            log.debug("No {} history to pre-sync", getCategory().getItemsName());
            return;
        }
        int batchSize = context.properties().getBatchSize();
        try (CloseableIterator<TrackedRecord> rows = progressLogger.wrap("presync", source)) {
            List<TrackedRecord> batch = new ArrayList<>(batchSize);
            while (rows.hasNext()) {
                batch.add(rows.next());
                if (batch.size() >= batchSize) {
                    context.store().addBatch(batch);
                    batch = new ArrayList<>(batchSize);
                    if (preSyncStopped) {
                        log.info("Presync {} stopped", getCategory().getItemsName());
                        return;
                    }
                }
            }
            if (!batch.isEmpty()) {
                context.store().addBatch(batch);
            }
        }
    }

    private void storeStream(Supplier<CloseableIterator<TrackedRecord>> factory) {
        try (CloseableIterator<TrackedRecord> rows = progressLogger.wrap("stream", factory.get())) {
            while (rows.hasNext()) {
                context.store().addOne(rows.next());
            }
        }
    }

    private boolean runWithRetry(String phase, Runnable body) {
        TrackerCategory category = getCategory();
        String operation = category.getItemsName() + " " + phase;
        try {
            return context.retryPolicy().run(operation, body);
        } catch (RuntimeException e) {
            log.error("{} failed permanently", operation, e);
            resetState();
            throw new TrackerException(category, operation + " failed: " + e.getMessage(), e);
        }
    }
}
