package com.lntracker.ingestion.pagination;

/**
 * Builds the request for the page starting at {@code offset}, asking for at most {@code pageSize} items.
 */
@FunctionalInterface
public interface PageRequestFactory<R> {

    R create(long offset, int pageSize);
}
