package com.lntracker.common;

import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LazyIteratorTest {

    private static final class CountingIterator extends LazyIterator<Integer> {
        private final Iterator<Integer> source;
        final AtomicInteger computed = new AtomicInteger();
        final AtomicInteger closed = new AtomicInteger();

        CountingIterator(List<Integer> values) {
            this.source = values.iterator();
        }

        @Override
        protected Integer computeNext() {
            computed.incrementAndGet();
            return source.hasNext() ? source.next() : endOfData();
        }

        @Override
        protected void onClose() {
            closed.incrementAndGet();
        }
    }

    @Test
    void iteratesLazilyAndClosesOnceExhausted() {
        CountingIterator it = new CountingIterator(List.of(1, 2));
        assertThat(it.computed).hasValue(0);

        List<Integer> values = new ArrayList<>();
        it.forEachRemaining(values::add);

        assertThat(values).containsExactly(1, 2);
        assertThat(it.closed).hasValue(1);
        assertThatThrownBy(it::next).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void close_stopsIterationAndRunsHookOnce() {
        CountingIterator it = new CountingIterator(List.of(1, 2, 3));
        it.next();

        it.close();
        it.close();

        assertThat(it.hasNext()).isFalse();
        assertThat(it.closed).hasValue(1);
    }

    @Test
    void progressLogger_closesSource() {
        CountingIterator source = new CountingIterator(List.of(1, 2, 3));
        StreamProgressLogger logger = new StreamProgressLogger(LoggerFactory.getLogger(getClass()), "items", 2);

        try (CloseableIterator<Integer> wrapped = logger.wrap("test", source)) {
            assertThat(wrapped.next()).isEqualTo(1);
        }

        assertThat(source.closed).hasValue(1);
    }
}
