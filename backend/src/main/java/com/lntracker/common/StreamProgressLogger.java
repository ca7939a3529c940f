package com.lntracker.common;

import org.slf4j.Logger;

/**
 * Counts items flowing through a stream and logs every {@code interval} items, plus a
 * summary when the stream is closed.
 */
public class StreamProgressLogger {

    private final Logger logger;
    private final String itemsName;
    private final int interval;

    public StreamProgressLogger(Logger logger, String itemsName, int interval) {
        if (interval <= 0) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.logger = logger;
        this.itemsName = itemsName;
        this.interval = interval;
    }

    /**
     * Wraps {@code source}; closing the result closes the source.
     */
    public <E> CloseableIterator<E> wrap(String streamName, CloseableIterator<E> source) {
        return new LazyIterator<>() {
            private long count;

            @Override
            protected E computeNext() {
                if (!source.hasNext()) {
                    return endOfData();
                }
                E item = source.next();
                count++;
                if (count % interval == 0) {
                    logger.info("{}: received {} {}", streamName, count, itemsName);
                }
                return item;
            }

            @Override
            protected void onClose() {
                logger.info("{}: stream closed after {} {}", streamName, count, itemsName);
                source.close();
            }
        };
    }
}
