package com.lntracker.ingestion.tracker;

import com.lntracker.common.CancellationToken;
import com.lntracker.common.MutableClock;
import com.lntracker.common.RetryPolicy;
import com.lntracker.ingestion.adapter.ErrorClassifier;
import com.lntracker.ingestion.adapter.ErrorKind;
import com.lntracker.ingestion.adapter.RpcException;
import com.lntracker.ingestion.config.TrackerProperties;
import com.lntracker.ingestion.stream.ScriptedUpstream;
import com.lntracker.ingestion.stream.StreamDispatcher;
import com.lntracker.ingestion.stream.StreamTerminatedException;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires a tracker context around {@link FakeLndNode} and {@link InMemoryTrackerStore}
 * with small pages and batches and no retry delay. Dispatchers treat UNAUTHENTICATED as fatal.
 */
class TrackerFixture implements AutoCloseable {

    static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    final CancellationToken token = new CancellationToken();
    final FakeLndNode node = new FakeLndNode();
    final InMemoryTrackerStore store = new InMemoryTrackerStore();
    final MutableClock clock = new MutableClock(NOW);
    final TrackerProperties properties = new TrackerProperties();
    final ExecutorService executor = Executors.newCachedThreadPool();
    private final RetryPolicy retryPolicy = RetryPolicy.builder(token)
            .maxRetries(1)
            .delay(Duration.ZERO)
            .abortOn(Set.of(StreamTerminatedException.class))
            .build();

    TrackerFixture() {
        properties.setPageSize(2);
        properties.setBatchSize(2);
        properties.setProgressLogInterval(1);
        properties.setGracePeriod(Duration.ZERO);
        properties.setQueuePollTimeout(Duration.ofMillis(50));
        properties.setForwardPollInterval(Duration.ofMillis(20));
    }

    TrackerContext context() {
        return new TrackerContext(new LndNode(node, properties.getPageSize(), token), store, retryPolicy, token,
                properties, clock);
    }

    <T> StreamDispatcher<T> dispatcher(String name, ScriptedUpstream<T> upstream) {
        ErrorClassifier classifier = e -> {
            if (e instanceof RpcException rpc) {
                return switch (rpc.getStatus()) {
                    case CANCELLED -> ErrorKind.USER_CANCELLED;
                    case UNAUTHENTICATED -> ErrorKind.FATAL;
                    default -> ErrorKind.TRANSIENT;
                };
            }
            return ErrorKind.TRANSIENT;
        };
        StreamDispatcher<T> dispatcher = new StreamDispatcher<>(name, upstream, classifier, retryPolicy, token,
                properties.getGracePeriod(), properties.getQueuePollTimeout());
        CompletableFuture.runAsync(dispatcher::start, executor);
        return dispatcher;
    }

    CompletableFuture<Void> runAsync(Runnable runnable) {
        return CompletableFuture.runAsync(runnable, executor);
    }

    /** Epoch nanos {@code daysAgo} days before {@link #NOW}. */
    static long nanosDaysAgo(int daysAgo) {
        Instant at = NOW.minus(Duration.ofDays(daysAgo));
        return at.getEpochSecond() * 1_000_000_000L;
    }

    @Override
    public void close() {
        token.cancel();
        executor.shutdownNow();
    }
}
