package com.lntracker.ingestion.stream;

import com.lntracker.common.CancellationToken;
import com.lntracker.common.CloseableIterator;
import com.lntracker.common.LazyIterator;
import com.lntracker.common.RetryPolicy;
import com.lntracker.ingestion.adapter.ErrorClassifier;
import com.lntracker.ingestion.adapter.ErrorKind;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Shares one upstream subscription between any number of in-process subscribers.
 * <p>
 * {@link #start()} runs on its own thread: it waits for the first subscriber, opens the
 * upstream, and copies every item into each subscriber's queue. When the upstream fails
 * every queue receives an {@link StreamOutcome.Ended} marker and the {@link RetryPolicy}
 * opens a new upstream subscription.
 * <p>
 * Each subscriber iterates on its own thread. A cycle waits until the dispatcher receives,
 * sleeps the grace period, drains the reconciliation source and then reads the live queue
 * until an {@code Ended} marker arrives. A cancellation marker ends the sequence; any other
 * marker starts a new cycle, because items may have been missed. Once the dispatcher has
 * stopped on an error, every sequence throws a {@link StreamTerminatedException}.
 *
 * @param <T> upstream item type
 */
@Slf4j
public class StreamDispatcher<T> {

    private final String name;
    private final Supplier<CloseableIterator<T>> upstreamFactory;
    private final ErrorClassifier errorClassifier;
    private final RetryPolicy retryPolicy;
    private final CancellationToken cancellationToken;
    private final Duration gracePeriod;
    private final Duration queuePollTimeout;

    private final List<Subscription<T>> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicInteger subscriptionIds = new AtomicInteger();
    private final AtomicBoolean running = new AtomicBoolean();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition stateChanged = lock.newCondition();

    private volatile DispatcherState state = DispatcherState.NOT_SUBSCRIBED;
    private volatile CloseableIterator<T> upstream;
    private volatile boolean stopRequested;
    private RuntimeException fatalError;
    private volatile RuntimeException terminalError;

    public StreamDispatcher(String name,
                            Supplier<CloseableIterator<T>> upstreamFactory,
                            ErrorClassifier errorClassifier,
                            RetryPolicy retryPolicy,
                            CancellationToken cancellationToken,
                            Duration gracePeriod,
                            Duration queuePollTimeout) {
        this.name = name;
        this.upstreamFactory = upstreamFactory;
        this.errorClassifier = errorClassifier;
        this.retryPolicy = retryPolicy;
        this.cancellationToken = cancellationToken;
        this.gracePeriod = gracePeriod;
        this.queuePollTimeout = queuePollTimeout;
        cancellationToken.onCancel(this::onTokenCancelled);
    }

    /**
     * Registers a subscriber. The returned factory creates a new sequence on every call,
     * each one starting with a reconciliation cycle.
     *
     * @param reconciliationSource may be null when the stream has nothing to backfill from
     */
    public <V> Supplier<CloseableIterator<V>> subscribe(ItemConverter<T, V> converter,
                                                        ReconciliationSourceFactory<V> reconciliationSource) {
        Subscription<T> subscription = new Subscription<>(subscriptionIds.incrementAndGet());
        subscriptions.add(subscription);
        lock.lock();
        try {
            if (state == DispatcherState.NOT_SUBSCRIBED) {
                state = DispatcherState.SUBSCRIBED_WAITING;
            }
            stateChanged.signalAll();
        } finally {
            lock.unlock();
        }
        log.debug("{}: subscriber {} registered", name, subscription.getId());
        return () -> new SubscriberIterator<>(subscription, converter, reconciliationSource);
    }

    /**
     * Runs the read loop until cancelled. Blocks the calling thread.
     *
     * @throws RuntimeException the last upstream error once the retry budget is spent, or
     *                          the typed error of a fatal upstream failure
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("{}: start() called while already running", name);
            return;
        }
        try {
            fatalError = null;
            terminalError = null;
            boolean completed = retryPolicy.run(name, this::readUpstream);
            if (!completed) {
                markCancelled();
            }
            if (fatalError != null) {
                throw fatalError;
            }
        } catch (RuntimeException e) {
            terminalError = e;
            setState(DispatcherState.STOPPED);
            throw e;
        } finally {
            running.set(false);
        }
    }

    /**
     * Closes the open upstream subscription, if any, and ends the read loop as cancelled.
     */
    public void stop() {
        stopRequested = true;
        CloseableIterator<T> current = upstream;
        if (current != null) {
            log.info("{}: closing upstream subscription", name);
            current.close();
        }
    }

    public String getName() {
        return name;
    }

    public DispatcherState getState() {
        return state;
    }

    public int getSubscriberCount() {
        return subscriptions.size();
    }

    List<Subscription<T>> getSubscriptions() {
        return Collections.unmodifiableList(subscriptions);
    }

    private void readUpstream() {
        if (!awaitSubscriber()) {
            markCancelled();
            return;
        }
        CloseableIterator<T> stream = null;
        try {
            stream = upstreamFactory.get();
            upstream = stream;
            if (cancellationToken.isCancelled() || stopRequested) {
                markCancelled();
                return;
            }
            log.info("{}: upstream subscription opened for {} subscribers", name, subscriptions.size());
            boolean first = true;
            while (stream.hasNext()) {
                T item = stream.next();
                if (first) {
                    setState(DispatcherState.RECEIVING);
                    first = false;
                }
                broadcast(StreamOutcome.item(item));
            }
            throw new StreamClosedException(name + ": upstream closed the subscription");
        } catch (RuntimeException e) {
            handleFailure(e);
        } finally {
            upstream = null;
            if (stream != null) {
                stream.close();
            }
        }
    }

    private void handleFailure(RuntimeException e) {
        boolean closed = e instanceof StreamClosedException;
        ErrorKind kind = closed ? ErrorKind.TRANSIENT : errorClassifier.classify(e);
        if (cancellationToken.isCancelled() || stopRequested || kind == ErrorKind.USER_CANCELLED) {
            log.info("{}: upstream subscription cancelled", name);
            markCancelled();
            return;
        }
        if (kind == ErrorKind.FATAL) {
            log.error("{}: fatal upstream error, not retrying", name, e);
            fatalError = errorClassifier.toDomainError(e).orElse(e);
            terminalError = fatalError;
            setState(DispatcherState.STOPPED);
            broadcast(StreamOutcome.failed(e));
            return;
        }
        setState(DispatcherState.SUBSCRIBED_WAITING);
        broadcast(StreamOutcome.failed(e));
        throw e;
    }

    private boolean awaitSubscriber() {
        lock.lock();
        try {
            while (subscriptions.isEmpty()) {
                if (cancellationToken.isCancelled() || stopRequested) {
                    return false;
                }
                stateChanged.await(queuePollTimeout.toMillis(), TimeUnit.MILLISECONDS);
            }
            if (state != DispatcherState.RECEIVING) {
                state = DispatcherState.SUBSCRIBED_WAITING;
            }
            return !cancellationToken.isCancelled() && !stopRequested;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return true once receiving, false if cancelled or stopped first
     */
    private boolean awaitReceiving() {
        lock.lock();
        try {
            while (state != DispatcherState.RECEIVING) {
                if (cancellationToken.isCancelled() || state == DispatcherState.STOPPED) {
                    return false;
                }
                stateChanged.await(queuePollTimeout.toMillis(), TimeUnit.MILLISECONDS);
            }
            return !cancellationToken.isCancelled();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            lock.unlock();
        }
    }

    private void markCancelled() {
        setState(DispatcherState.STOPPED);
        broadcast(StreamOutcome.cancelled());
    }

    private void onTokenCancelled() {
        broadcast(StreamOutcome.cancelled());
        lock.lock();
        try {
            stateChanged.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private void broadcast(StreamOutcome<T> outcome) {
        for (Subscription<T> subscription : subscriptions) {
            subscription.offer(outcome);
        }
    }

    private void setState(DispatcherState newState) {
        lock.lock();
        try {
            if (state != newState) {
                log.debug("{}: {} -> {}", name, state, newState);
                state = newState;
            }
            stateChanged.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private enum Phase { WAIT, RECONCILE, LIVE }

    private final class SubscriberIterator<V> extends LazyIterator<V> {

        private final Subscription<T> subscription;
        private final ItemConverter<T, V> converter;
        private final ReconciliationSourceFactory<V> reconciliationSource;

        private Phase phase = Phase.WAIT;
        private CloseableIterator<V> reconciliation;
        private Iterator<V> pending = Collections.emptyIterator();

        SubscriberIterator(Subscription<T> subscription,
                           ItemConverter<T, V> converter,
                           ReconciliationSourceFactory<V> reconciliationSource) {
            this.subscription = subscription;
            this.converter = converter;
            this.reconciliationSource = reconciliationSource;
        }

        @Override
        protected V computeNext() {
            while (true) {
                if (pending.hasNext()) {
                    return pending.next();
                }
                switch (phase) {
                    case WAIT -> {
                        if (!awaitReceiving()) {
                            RuntimeException error = terminalError;
                            if (error != null && !cancellationToken.isCancelled()) {
                                throw new StreamTerminatedException(name, error);
                            }
                            return endOfData();
                        }
                        subscription.setInRecon(true);
                        if (cancellationToken.await(gracePeriod)) {
                            return endOfData();
                        }
                        reconciliation = openReconciliation();
                        phase = Phase.RECONCILE;
                    }
                    case RECONCILE -> {
                        if (reconciliation != null && reconciliation.hasNext()) {
                            return reconciliation.next();
                        }
                        closeReconciliation();
                        phase = Phase.LIVE;
                    }
                    case LIVE -> {
                        if (cancellationToken.isCancelled()) {
                            return endOfData();
                        }
                        if (subscription.isInRecon() && subscription.isQueueEmpty()) {
                            subscription.setInRecon(false);
                            log.debug("{}: subscriber {} caught up with the live stream", name, subscription.getId());
                        }
                        StreamOutcome<T> outcome;
                        try {
                            outcome = subscription.poll(queuePollTimeout);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            return endOfData();
                        }
                        if (outcome instanceof StreamOutcome.Ended<T> ended) {
                            if (ended.reason() == StreamOutcome.EndReason.CANCELLED) {
                                return endOfData();
                            }
                            log.warn("{}: subscriber {} lost the live stream ({}), reconciling again",
                                    name, subscription.getId(), describe(ended.cause()));
                            phase = Phase.WAIT;
                        } else if (outcome instanceof StreamOutcome.Item<T> item) {
                            pending = converter.convert(item.value(), subscription.isInRecon()).iterator();
                        }
                    }
                }
            }
        }

        private CloseableIterator<V> openReconciliation() {
            if (reconciliationSource == null) {
                log.info("{}: no reconciliation source for subscriber {}", name, subscription.getId());
                return null;
            }
            log.debug("{}: starting reconciliation for subscriber {}", name, subscription.getId());
            return reconciliationSource.open();
        }

        private void closeReconciliation() {
            if (reconciliation != null) {
                reconciliation.close();
                reconciliation = null;
            }
        }

        @Override
        protected void onClose() {
            closeReconciliation();
        }
    }

    private static String describe(Throwable cause) {
        return cause != null ? cause.getMessage() : "unknown";
    }
}
