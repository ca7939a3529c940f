package com.lntracker.common;

import java.util.Collections;
import java.util.Iterator;

/**
 * Lazy sequence that owns a resource (an HTTP stream, a page cursor) and must be closed
 * when the consumer stops early.
 */
public interface CloseableIterator<E> extends Iterator<E>, AutoCloseable {

    @Override
    void close();

    static <E> CloseableIterator<E> of(Iterator<E> delegate) {
        return new CloseableIterator<>() {
            @Override
            public boolean hasNext() {
                return delegate.hasNext();
            }

            @Override
            public E next() {
                return delegate.next();
            }

            @Override
            public void close() {
                // nothing held
            }
        };
    }

    static <E> CloseableIterator<E> empty() {
        return of(Collections.emptyIterator());
    }
}
