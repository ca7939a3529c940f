package com.lntracker.common;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative stop signal shared by every blocking loop of the ingestion engine.
 * Waits go through {@link #await(Duration)} instead of {@code Thread.sleep} so a cancel
 * reaches all loops within one poll interval. Cancelling never throws into the waiters.
 */
@Slf4j
public class CancellationToken {

    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    /**
     * Idempotent. Listeners run once, on the first call, in the calling thread.
     */
    public void cancel() {
        if (latch.getCount() == 0) {
            return;
        }
        latch.countDown();
        for (Runnable listener : listeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation listener failed: {}", e.getMessage(), e);
            }
        }
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    /**
     * Waits up to {@code timeout} or until cancelled.
     *
     * @return true if the token is cancelled when the wait ends
     */
    public boolean await(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return isCancelled();
        }
        try {
            return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            // an interrupted waiter unwinds like a cancelled one
            return true;
        }
    }

    /**
     * Registers a callback fired on cancel. Fires immediately if already cancelled.
     */
    public void onCancel(Runnable listener) {
        listeners.add(listener);
        if (isCancelled() && listeners.remove(listener)) {
            listener.run();
        }
    }
}
