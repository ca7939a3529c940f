package com.lntracker.ingestion.job;

import com.lntracker.common.CancellationToken;
import com.lntracker.config.AsyncConfig;
import com.lntracker.domain.TrackerCategory;
import com.lntracker.domain.TrackerStatus;
import com.lntracker.ingestion.stream.StreamDispatcher;
import com.lntracker.ingestion.tracker.Tracker;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Starts every dispatcher read loop and, per tracker, the live loop and the pre-sync on the
 * tracker executor once the application is ready. A failing tracker is marked FAILED; the
 * others keep running.
 */
@Component
@Slf4j
public class TrackerRunner {

    private final List<Tracker> trackers;
    private final List<StreamDispatcher<?>> dispatchers;
    private final CancellationToken cancellationToken;
    private final TrackerStatusRegistry statusRegistry;
    private final Executor trackerExecutor;
    private final AtomicBoolean started = new AtomicBoolean(false);

    public TrackerRunner(List<Tracker> trackers,
                         List<StreamDispatcher<?>> dispatchers,
                         CancellationToken cancellationToken,
                         TrackerStatusRegistry statusRegistry,
                         @Qualifier(AsyncConfig.TRACKER_EXECUTOR) Executor trackerExecutor) {
        this.trackers = trackers;
        this.dispatchers = dispatchers;
        this.cancellationToken = cancellationToken;
        this.statusRegistry = statusRegistry;
        this.trackerExecutor = trackerExecutor;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        startAll();
    }

    void startAll() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        for (StreamDispatcher<?> dispatcher : dispatchers) {
            trackerExecutor.execute(() -> runDispatcher(dispatcher));
        }
        for (Tracker tracker : trackers) {
            statusRegistry.update(tracker.getCategory(), TrackerStatus.PRE_SYNC);
            trackerExecutor.execute(() -> runLive(tracker));
            trackerExecutor.execute(() -> runPreSync(tracker));
        }
        log.info("Started {} dispatchers and {} trackers", dispatchers.size(), trackers.size());
    }

    @PreDestroy
    public void shutdown() {
        log.info("Stopping trackers");
        cancellationToken.cancel();
        for (StreamDispatcher<?> dispatcher : dispatchers) {
            dispatcher.stop();
        }
        for (Tracker tracker : trackers) {
            tracker.preSyncStop();
        }
        log.info("Tracker status at shutdown: {}", statusRegistry.snapshot());
    }

    private void runDispatcher(StreamDispatcher<?> dispatcher) {
        try {
            dispatcher.start();
            log.info("Dispatcher {} stopped", dispatcher.getName());
        } catch (RuntimeException e) {
            log.error("Dispatcher {} failed", dispatcher.getName(), e);
        }
    }

    private void runPreSync(Tracker tracker) {
        TrackerCategory category = tracker.getCategory();
        try {
            tracker.preSyncStart();
            if (!cancellationToken.isCancelled()) {
                statusRegistry.update(category, TrackerStatus.RUNNING);
            }
        } catch (RuntimeException e) {
            log.error("Presync of {} failed", category, e);
            statusRegistry.markFailed(category, e);
        }
    }

    private void runLive(Tracker tracker) {
        TrackerCategory category = tracker.getCategory();
        try {
            tracker.start();
            statusRegistry.update(category, TrackerStatus.STOPPED);
        } catch (RuntimeException e) {
            log.error("Tracker {} failed", category, e);
            statusRegistry.markFailed(category, e);
        }
    }
}
