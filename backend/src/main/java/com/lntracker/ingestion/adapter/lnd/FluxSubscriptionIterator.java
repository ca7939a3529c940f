package com.lntracker.ingestion.adapter.lnd;

import com.lntracker.common.LazyIterator;
import com.lntracker.ingestion.adapter.RpcException;
import com.lntracker.ingestion.adapter.RpcStatus;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Bridges a server-push {@link Flux} to a blocking iterator. Closing it, from any thread,
 * disposes the HTTP exchange and makes a pending {@code hasNext()} fail with
 * {@link RpcStatus#CANCELLED}.
 */
final class FluxSubscriptionIterator<T> extends LazyIterator<T> {

    private static final Object COMPLETED = new Object();
    private static final Object CANCELLED = new Object();

    private record Failure(Throwable error) {}

    private final String streamName;
    private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private final Disposable disposable;

    FluxSubscriptionIterator(String streamName, Flux<T> flux) {
        this.streamName = streamName;
        this.disposable = flux.subscribe(
                queue::add,
                e -> queue.add(new Failure(e)),
                () -> queue.add(COMPLETED));
    }

    @Override
    @SuppressWarnings("unchecked")
    protected T computeNext() {
        Object next;
        try {
            next = queue.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            disposable.dispose();
            throw new RpcException(RpcStatus.CANCELLED, streamName + " interrupted", e);
        }
        if (next == COMPLETED) {
            return endOfData();
        }
        if (next == CANCELLED) {
            throw new RpcException(RpcStatus.CANCELLED, streamName + " cancelled");
        }
        if (next instanceof Failure failure) {
            if (failure.error() instanceof RpcException rpcException) {
                throw rpcException;
            }
            throw new RpcException(RpcStatus.UNAVAILABLE, streamName + ": " + failure.error().getMessage(), failure.error());
        }
        return (T) next;
    }

    @Override
    protected void onClose() {
        disposable.dispose();
        queue.add(CANCELLED);
    }
}
