package com.lntracker.ingestion.stream;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * One consumer's queue on a {@link StreamDispatcher}. Filled by the dispatcher thread,
 * drained by the consumer thread; lives as long as the dispatcher.
 */
public class Subscription<T> {

    private final int id;
    private final BlockingQueue<StreamOutcome<T>> queue = new LinkedBlockingQueue<>();
    private volatile boolean inRecon;

    Subscription(int id) {
        this.id = id;
    }

    void offer(StreamOutcome<T> outcome) {
        queue.add(outcome);
    }

    /**
     * @return the next outcome, or null if none arrived within {@code timeout}
     */
    StreamOutcome<T> poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    boolean isQueueEmpty() {
        return queue.isEmpty();
    }

    public int getId() {
        return id;
    }

    public boolean isInRecon() {
        return inRecon;
    }

    void setInRecon(boolean inRecon) {
        this.inRecon = inRecon;
    }

    public int queuedOutcomes() {
        return queue.size();
    }
}
