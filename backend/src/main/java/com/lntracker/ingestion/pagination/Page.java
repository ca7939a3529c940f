package com.lntracker.ingestion.pagination;

import java.util.List;

/**
 * One page of a paginated response: the items and the offset to ask for next.
 */
public record Page<I>(List<I> items, long nextOffset) {

    public Page {
        items = items != null ? List.copyOf(items) : List.of();
    }
}
