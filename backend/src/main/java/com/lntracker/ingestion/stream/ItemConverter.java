package com.lntracker.ingestion.stream;

/**
 * Maps one upstream item to zero or more output rows.
 *
 * @param <T> upstream item
 * @param <V> produced row
 */
@FunctionalInterface
public interface ItemConverter<T, V> {

    /**
     * @param reconRunning true while the subscriber has not caught up with the live stream yet
     */
    Iterable<V> convert(T item, boolean reconRunning);
}
