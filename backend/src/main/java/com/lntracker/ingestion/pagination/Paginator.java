package com.lntracker.ingestion.pagination;

import com.lntracker.common.CancellationToken;
import com.lntracker.common.CloseableIterator;
import com.lntracker.common.LazyIterator;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Iterator;
import java.util.function.Function;

/**
 * Offset-based reader over a paginated list call.
 * <p>
 * Each {@link #request} returns a lazy sequence: pages are fetched only when the consumer
 * needs more items. Without a blocking interval the sequence ends after the first short
 * page; with one it waits and polls again from the last offset, which turns it into a
 * tailing reader that only the {@link CancellationToken} or {@code close()} ends.
 *
 * @param <R> request type
 * @param <S> response type
 * @param <I> item type
 */
@Slf4j
public class Paginator<R, S, I> {

    private final Function<R, S> fetchPage;
    private final Function<S, Page<I>> readResponse;
    private final PageRequestFactory<R> requestFactory;
    private final int maxPageSize;
    private final CancellationToken cancellationToken;

    public Paginator(Function<R, S> fetchPage,
                     Function<S, Page<I>> readResponse,
                     PageRequestFactory<R> requestFactory,
                     int maxPageSize,
                     CancellationToken cancellationToken) {
        if (maxPageSize <= 0) {
            throw new IllegalArgumentException("maxPageSize must be positive");
        }
        this.fetchPage = fetchPage;
        this.readResponse = readResponse;
        this.requestFactory = requestFactory;
        this.maxPageSize = maxPageSize;
        this.cancellationToken = cancellationToken;
    }

    /**
     * @param maxItems    upper bound on items to yield; null for no bound
     * @param blocking    wait between polls once the end is reached; null to stop at the end
     * @param startOffset offset of the first request
     */
    public CloseableIterator<I> request(Integer maxItems, Duration blocking, long startOffset) {
        if (maxItems != null && maxItems < 0) {
            throw new IllegalArgumentException("maxItems must not be negative");
        }
        return new PageIterator(maxItems, blocking, startOffset);
    }

    public int getMaxPageSize() {
        return maxPageSize;
    }

    private final class PageIterator extends LazyIterator<I> {

        private final Duration blocking;
        private Integer remaining;
        private long offset;
        private Iterator<I> current = null;
        private boolean lastPageShort;

        PageIterator(Integer maxItems, Duration blocking, long startOffset) {
            this.remaining = maxItems;
            this.blocking = blocking;
            this.offset = startOffset;
        }

        @Override
        protected I computeNext() {
            while (true) {
                if (remaining != null && remaining == 0) {
                    return endOfData();
                }
                if (current != null && current.hasNext()) {
                    if (remaining != null) {
                        remaining--;
                    }
                    return current.next();
                }
                if (current != null && lastPageShort) {
                    if (blocking == null) {
                        return endOfData();
                    }
                    if (cancellationToken.await(blocking)) {
                        return endOfData();
                    }
                }
                if (cancellationToken.isCancelled()) {
                    return endOfData();
                }
                fetch();
            }
        }

        private void fetch() {
            int size = remaining != null ? Math.min(remaining, maxPageSize) : maxPageSize;
            R request = requestFactory.create(offset, size);
            Page<I> page = readResponse.apply(fetchPage.apply(request));
            log.trace("Fetched {} items at offset {}, next offset {}", page.items().size(), offset, page.nextOffset());
            if (!page.items().isEmpty()) {
                offset = page.nextOffset();
            }
            lastPageShort = page.items().size() < size;
            current = page.items().iterator();
        }

        @Override
        protected void onClose() {
            current = null;
        }
    }
}
