package com.lntracker.ingestion.stream;

/**
 * What the dispatcher thread hands to a subscriber queue: an item or the end of the
 * current upstream subscription.
 */
public sealed interface StreamOutcome<T> permits StreamOutcome.Item, StreamOutcome.Ended {

    enum EndReason { CANCELLED, ERROR }

    record Item<T>(T value) implements StreamOutcome<T> {}

    record Ended<T>(EndReason reason, Throwable cause) implements StreamOutcome<T> {}

    static <T> StreamOutcome<T> item(T value) {
        return new Item<>(value);
    }

    static <T> StreamOutcome<T> cancelled() {
        return new Ended<>(EndReason.CANCELLED, null);
    }

    static <T> StreamOutcome<T> failed(Throwable cause) {
        return new Ended<>(EndReason.ERROR, cause);
    }
}
