package com.lntracker.ingestion.stream;

import com.lntracker.common.CloseableIterator;
import com.lntracker.common.LazyIterator;

import java.util.Collections;
import java.util.Iterator;
import java.util.function.Function;

/**
 * Flat-maps a closeable source through a converter. Closing the converter closes the source.
 */
public class StreamConverter<T, V> extends LazyIterator<V> {

    private final CloseableIterator<T> source;
    private final Function<T, Iterable<V>> converter;
    private Iterator<V> pending = Collections.emptyIterator();

    public StreamConverter(CloseableIterator<T> source, Function<T, Iterable<V>> converter) {
        this.source = source;
        this.converter = converter;
    }

    @Override
    protected V computeNext() {
        while (!pending.hasNext()) {
            if (!source.hasNext()) {
                return endOfData();
            }
            pending = converter.apply(source.next()).iterator();
        }
        return pending.next();
    }

    @Override
    protected void onClose() {
        source.close();
    }
}
